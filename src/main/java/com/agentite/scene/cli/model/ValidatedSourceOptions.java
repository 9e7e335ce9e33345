package com.agentite.scene.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Options after validation: normalized input files, the requested mode and the output target.
 */
@Getter
@RequiredArgsConstructor
public class ValidatedSourceOptions {
    private final List<Path> files;
    private final SourceMode mode;
    /** Output file, or null for standard output. */
    private final Path output;
}
