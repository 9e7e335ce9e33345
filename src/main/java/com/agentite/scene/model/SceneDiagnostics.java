package com.agentite.scene.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics (errors/warnings/info) accumulated while validating, spawning or loading content.
 *
 * Passing an instance turns on strict reporting of soft failures such as unknown components,
 * unknown fields and mismatched value types. Those failures never abort; they only land here.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class SceneDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public void warn(String message) {
        warnings.add(message);
    }
}
