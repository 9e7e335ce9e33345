package com.agentite.scene.cli.model;

import java.nio.file.Path;
import java.util.Locale;

/**
 * How a definition file is parsed: a single prefab entity or a scene of root entities.
 */
public enum SourceMode {
    AUTO,
    SCENE,
    PREFAB;

    /**
     * Concrete mode for a file; AUTO picks PREFAB for {@code .prefab} files and SCENE otherwise.
     */
    public SourceMode resolve(Path file) {
        if (this != AUTO) {
            return this;
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".prefab") ? PREFAB : SCENE;
    }
}
