package com.structural.topology.export;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.topology.model.GenerationResult;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Serialises a generated topology into a STAAD-style structural command file.
 * The generated model itself is never modified; the axis convention is applied
 * to the rendered coordinates only.
 */
public class StructuralModelWriter {

    private static final Logger log = LoggerFactory.getLogger(StructuralModelWriter.class);

    static final String TEMPLATE_NAME = "structural-model.ftl";

    private final Configuration freemarkerConfig;

    public StructuralModelWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setNumberFormat("computer");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(GenerationResult result, ExportSettings settings) {
        StructuralModelView view = StructuralModelView.of(result, settings);
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(view, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ExportException("Failed to render " + result.getKind() + " model: " + e.getMessage(), e);
        }
    }

    /**
     * Renders the model and writes it to {@code target}, creating parent directories.
     */
    public void write(GenerationResult result, ExportSettings settings, Path target) throws IOException {
        String content = render(result, settings);
        Path parentDir = target.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(target, content);
        log.info("Wrote {} joints, {} members and {} plates to {}", result.getJoints().size(),
                result.getMembers().size(), result.getPlates().size(), target.toAbsolutePath());
    }
}
