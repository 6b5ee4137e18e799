package com.batchjob.generator.codegen.template;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import com.batchjob.generator.codegen.model.core.context.GeneratorConfig;
import com.batchjob.generator.codegen.model.input.JobHeader;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the fixed parts of a job script (header, initialization block, trailer) from the
 * FreeMarker templates on the classpath. Templates use '\n' line separators.
 */
public class ScriptTemplateRenderer {

    static final String HEADER = "header.ftl";
    static final String INITIALIZATION = "initialization.ftl";
    static final String TRAILER = "trailer.ftl";

    private final Configuration freemarkerConfig;

    public ScriptTemplateRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String renderHeader(JobHeader header, GeneratorConfig config) {
        return render(HEADER, Map.of(
                "jobName", header.getBaseName(),
                "date", config.getDate(),
                "author", header.getAuthor(),
                "title", header.getTitle(),
                "description", header.getDescription(),
                "user", config.getUser()));
    }

    public String renderInitialization(JobHeader header) {
        return render(INITIALIZATION, Map.of("jobName", header.getBaseName()));
    }

    public String renderTrailer() {
        return render(TRAILER, Map.of());
    }

    private String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter writer = new StringWriter();
            template.process(model, writer);
            return writer.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Unable to render template " + templateName, e);
        }
    }
}
