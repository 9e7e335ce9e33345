package com.agentite.scene.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Options shared by the scenetool subcommands. No validation, no execution logic, no printing.
 */
@Getter
public class SourceOptions {

    @Parameters(paramLabel = "FILE", description = "Prefab or scene definition files")
    private List<Path> files = new ArrayList<>();

    @Option(names = { "--scene" }, description = "Parse every file as a scene (one or more root entities)")
    private boolean scene;

    @Option(names = { "--prefab" }, description = "Parse every file as a single prefab entity")
    private boolean prefab;

    public SourceMode requestedMode() {
        if (scene) {
            return SourceMode.SCENE;
        }
        return prefab ? SourceMode.PREFAB : SourceMode.AUTO;
    }
}
