package com.agentite.scene.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.agentite.scene.cli.exception.OptionsValidationException;
import com.agentite.scene.cli.model.SourceOptions;
import com.agentite.scene.cli.model.ValidatedSourceOptions;
import com.agentite.scene.cli.output.ToolResultsPrinter;
import com.agentite.scene.cli.validation.SourceOptionsValidator;
import com.agentite.scene.registry.SceneLoadException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Re-emits a definition file in canonical form.
 */
@Command(name = "format", mixinStandardHelpOptions = true,
        description = "Rewrite a definition file in canonical form.")
public class FormatCommand implements Callable<Integer> {

    @Mixin
    private SourceOptions options;

    @Option(names = { "--output", "-o" }, description = "Output file (defaults to standard output)")
    private Path output;

    @Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
    private boolean force;

    @Spec
    private CommandSpec spec;

    private final SourceOptionsValidator validator = new SourceOptionsValidator();
    private final SourceInspectionService inspector = new SourceInspectionService();
    private final ToolResultsPrinter printer = new ToolResultsPrinter();

    @Override
    public Integer call() {
        ValidatedSourceOptions validated;
        try {
            validated = validator.validate(options, true, output, force);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return SceneToolCommand.EXIT_USAGE;
        }

        Path input = validated.getFiles().get(0);
        try {
            String formatted = inspector.format(input, validated.getMode());
            if (validated.getOutput() == null) {
                spec.commandLine().getOut().print(formatted);
                spec.commandLine().getOut().flush();
            } else {
                Files.writeString(validated.getOutput(), formatted, StandardCharsets.UTF_8);
                printer.printFormatted(input, validated.getOutput());
            }
            return SceneToolCommand.EXIT_OK;
        } catch (SceneLoadException | IOException e) {
            printer.printFailure(input, e.getMessage());
            return SceneToolCommand.EXIT_FAILED;
        }
    }
}
