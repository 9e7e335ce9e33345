package com.agentite.scene.cli.output;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the report of the "check" command from the {@code check-report.ftl} template.
 */
public class CheckReportRenderer {

    static final String TEMPLATE = "check-report.ftl";

    private final Configuration freemarkerConfig;

    public CheckReportRenderer() {
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

    public String render(List<FileReport> reports) throws IOException, TemplateException {
        long passed = reports.stream().filter(FileReport::isSuccess).count();

        Map<String, Object> model = new HashMap<>();
        model.put("files", reports);
        model.put("passed", passed);
        model.put("failed", reports.size() - passed);

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        template.process(model, out);
        return out.toString();
    }
}
