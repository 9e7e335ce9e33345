package com.agentite.scene.cli;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentite.scene.cli.exception.OptionsValidationException;
import com.agentite.scene.cli.model.SourceOptions;
import com.agentite.scene.cli.model.ValidatedSourceOptions;
import com.agentite.scene.cli.output.CheckReportRenderer;
import com.agentite.scene.cli.output.FileReport;
import com.agentite.scene.cli.output.ToolResultsPrinter;
import com.agentite.scene.cli.validation.SourceOptionsValidator;

import freemarker.template.TemplateException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Parses definition files and prints a report per file.
 */
@Command(name = "check", mixinStandardHelpOptions = true,
        description = "Parse definition files and report entities, components and asset references.")
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Mixin
    private SourceOptions options;

    @Spec
    private CommandSpec spec;

    private final SourceOptionsValidator validator = new SourceOptionsValidator();
    private final SourceInspectionService inspector = new SourceInspectionService();
    private final CheckReportRenderer renderer = new CheckReportRenderer();
    private final ToolResultsPrinter printer = new ToolResultsPrinter();

    @Override
    public Integer call() {
        ValidatedSourceOptions validated;
        try {
            validated = validator.validate(options, false, null, false);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return SceneToolCommand.EXIT_USAGE;
        }

        List<FileReport> reports = new ArrayList<>();
        validated.getFiles().forEach(file -> reports.add(inspector.check(file, validated.getMode())));

        try {
            spec.commandLine().getOut().print(renderer.render(reports));
            spec.commandLine().getOut().flush();
        } catch (IOException | TemplateException e) {
            log.error("Failed to render check report", e);
            return SceneToolCommand.EXIT_FAILED;
        }

        printer.printCheckSummary(reports);
        return reports.stream().allMatch(FileReport::isSuccess) ? SceneToolCommand.EXIT_OK : SceneToolCommand.EXIT_FAILED;
    }
}
