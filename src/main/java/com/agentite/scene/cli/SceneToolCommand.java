package com.agentite.scene.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command of the prefab/scene definition tool.
 */
@Command(
        name = "scenetool",
        mixinStandardHelpOptions = true,
        version = "scenetool 1.0.0",
        description = "Checks, formats and inspects prefab and scene definition files.",
        subcommands = { CheckCommand.class, FormatCommand.class, AssetsCommand.class }
)
public class SceneToolCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_USAGE;
    }
}
