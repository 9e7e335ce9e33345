package com.agentite.scene;

import com.agentite.scene.cli.SceneToolCommand;

import picocli.CommandLine;

/**
 * Main entry point of the scenetool command line.
 */
public class SceneToolApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SceneToolCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
