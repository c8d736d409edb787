package com.structural.topology.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.topology.cli.exception.OptionsValidationException;
import com.structural.topology.cli.model.GenerateOptions;
import com.structural.topology.cli.model.ValidatedGenerateOptions;
import com.structural.topology.cli.output.GenerateResultsPrinter;
import com.structural.topology.cli.validation.GenerateOptionsValidator;
import com.structural.topology.export.ExportException;
import com.structural.topology.export.StructuralModelWriter;
import com.structural.topology.generator.TopologyGenerator;
import com.structural.topology.generator.TopologyValidationException;
import com.structural.topology.model.GenerationResult;
import com.structural.topology.model.TopologyCounts;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that generates a structural topology and optionally writes it as a
 * structural command file.
 */
@Command(
        name = "topology-gen",
        mixinStandardHelpOptions = true,
        version = "topology-gen 1.0.0",
        description = "Generates joint and member topologies for trusses, rigid frames, building grids and plate meshes."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final TopologyGenerator generator;
    private final StructuralModelWriter writer;
    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    public GenerateCommand() {
        this(new TopologyGenerator(), new StructuralModelWriter());
    }

    public GenerateCommand(TopologyGenerator generator, StructuralModelWriter writer) {
        this.generator = generator;
        this.writer = writer;
    }

    @Override
    public Integer call() {
        try {
            ValidatedGenerateOptions v = validator.validate(options);
            printer.printBanner(options, v);

            if (options.isPreview()) {
                TopologyCounts counts = generator.predictCounts(options.getKind(), v.getParameters());
                printer.printPreview(counts);
                return 0;
            }

            GenerationResult result = generator.generate(options.getKind(), v.getParameters());
            if (v.getOutputPath() != null) {
                writer.write(result, v.getExportSettings(), v.getOutputPath());
            }
            printer.printSuccess(options, v, result);
            return 0;
        } catch (OptionsValidationException e) {
            printer.printOptionErrors(e.getErrors());
            return 1;
        } catch (TopologyValidationException e) {
            printer.printViolations(e.getViolations());
            return 1;
        } catch (IOException | ExportException e) {
            log.error("Failed to write structural model: {}", e.getMessage(), e);
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }
}
