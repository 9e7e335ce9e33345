package com.agentite.scene.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.agentite.scene.cli.exception.OptionsValidationException;
import com.agentite.scene.cli.model.SourceOptions;
import com.agentite.scene.cli.model.ValidatedSourceOptions;
import com.agentite.scene.cli.output.ToolResultsPrinter;
import com.agentite.scene.cli.validation.SourceOptionsValidator;
import com.agentite.scene.registry.SceneLoadException;
import com.agentite.scene.scene.AssetRef;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Lists the external assets a definition file refers to, one {@code TYPE<TAB>path} line each.
 */
@Command(name = "assets", mixinStandardHelpOptions = true,
        description = "List asset references (textures, sounds, prefabs...) of definition files.")
public class AssetsCommand implements Callable<Integer> {

    @Mixin
    private SourceOptions options;

    @Spec
    private CommandSpec spec;

    private final SourceOptionsValidator validator = new SourceOptionsValidator();
    private final SourceInspectionService inspector = new SourceInspectionService();
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

        PrintWriter out = spec.commandLine().getOut();
        int exitCode = SceneToolCommand.EXIT_OK;
        for (Path file : validated.getFiles()) {
            try {
                for (AssetRef ref : inspector.assets(file, validated.getMode())) {
                    out.println(ref.getType() + "\t" + ref.getPath());
                }
            } catch (SceneLoadException e) {
                printer.printFailure(file, e.getMessage());
                exitCode = SceneToolCommand.EXIT_FAILED;
            }
        }
        out.flush();
        return exitCode;
    }
}
