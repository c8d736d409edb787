package com.structural.topology.cli.output;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.topology.cli.model.GenerateOptions;
import com.structural.topology.cli.model.ValidatedGenerateOptions;
import com.structural.topology.export.IdRanges;
import com.structural.topology.generator.ParameterViolation;
import com.structural.topology.model.GenerationResult;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.Measure;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyCounts;

/**
 * Responsible only for printing CLI output for the "topology-gen" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Structural Topology Generator");
        log.info("=================================================");
        log.info("Kind: {} ({}, {} family)", o.getKind(), o.getKind().getDisplayName(), o.getKind().getFamily());
        log.info("Parameters: {}", v.getParameters());
        log.info("Output File: {}", v.getOutputPath() != null ? v.getOutputPath() : "None");
        if (v.getOutputPath() != null) {
            log.info("Units: {}", v.getExportSettings().getUnits().getKeyword());
            log.info("Axis Convention: {}", v.getExportSettings().getAxis());
            log.info("Material: {}", v.getExportSettings().getMaterial());
            log.info("Supports: {}", v.getExportSettings().isEmitSupports()
                    ? v.getExportSettings().getSupportType() : "None");
            log.info("Loads: {}", v.getExportSettings().getLoads());
        }
        log.info("=================================================");
    }

    public void printPreview(TopologyCounts counts) {
        log.info("");
        log.info("=================================================");
        log.info("PREDICTED COUNTS");
        log.info("=================================================");
        printCounts(counts);
        log.info("=================================================");
    }

    public void printSuccess(GenerateOptions o, ValidatedGenerateOptions v, GenerationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        printCounts(result.counts());

        log.info("");
        log.info("Landmarks:");
        for (Map.Entry<Landmark, List<Integer>> entry : result.getLandmarks().entrySet()) {
            log.info("  {}: {}", entry.getKey(), IdRanges.format(entry.getValue()));
        }

        if (!result.getMeasures().isEmpty()) {
            log.info("");
            log.info("Measures:");
            for (Map.Entry<Measure, Double> entry : result.getMeasures().entrySet()) {
                log.info("  {}: {}", entry.getKey(), formatMeasure(entry.getValue()));
            }
        }

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            for (String warning : result.getWarnings()) {
                log.warn("Warning: {}", warning);
            }
        }

        if (v.getOutputPath() != null) {
            log.info("");
            log.info("Output Path: {}", v.getOutputPath());
        }
        log.info("=================================================");
    }

    public void printOptionErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(error -> log.error("  {}", error));
    }

    public void printViolations(List<ParameterViolation> violations) {
        log.error("Invalid topology parameters:");
        violations.forEach(violation -> log.error("  {}", violation));
    }

    /**
     * Measures always print with a dot separator, whatever the default locale.
     */
    static String formatMeasure(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private void printCounts(TopologyCounts counts) {
        log.info("Joints: {}", counts.getJoints());
        log.info("Members: {}", counts.getMembers());
        if (counts.getPlates() > 0) {
            log.info("Plates: {}", counts.getPlates());
        }
        for (MemberRole role : MemberRole.values()) {
            int count = counts.membersWithRole(role);
            if (count > 0) {
                log.info("  {}: {}", role.getLabel(), count);
            }
        }
    }
}
