package com.agentite.scene.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.agentite.scene.cli.exception.OptionsValidationException;
import com.agentite.scene.cli.model.SourceOptions;
import com.agentite.scene.cli.model.ValidatedSourceOptions;

/**
 * Checks scenetool options and collects every problem before failing.
 */
public class SourceOptionsValidator {

    /**
     * @param singleFile the command takes exactly one input file
     * @param output     requested output file, or null for standard output
     * @param force      overwrite an existing output file
     */
    public ValidatedSourceOptions validate(SourceOptions o, boolean singleFile, Path output, boolean force) {
        List<String> errors = new ArrayList<>();

        if (o.isScene() && o.isPrefab()) {
            errors.add("Options --scene and --prefab are mutually exclusive.");
        }

        List<Path> files = new ArrayList<>();
        if (o.getFiles().isEmpty()) {
            errors.add("At least one input file is required.");
        } else if (singleFile && o.getFiles().size() != 1) {
            errors.add("Exactly one input file is required. Got: " + o.getFiles().size());
        }

        for (Path file : o.getFiles()) {
            Path normalized = file.toAbsolutePath().normalize();
            if (!Files.isRegularFile(normalized)) {
                errors.add("Input file does not exist or is not a regular file: " + file);
            } else if (!Files.isReadable(normalized)) {
                errors.add("Input file is not readable: " + file);
            }
            files.add(normalized);
        }

        Path normalizedOutput = null;
        if (output != null) {
            normalizedOutput = output.toAbsolutePath().normalize();
            if (Files.isDirectory(normalizedOutput)) {
                errors.add("Output path is a directory: " + output);
            } else if (Files.exists(normalizedOutput) && !force) {
                errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
            }
            Path parent = normalizedOutput.getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                errors.add("Output directory does not exist: " + parent);
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedSourceOptions(List.copyOf(files), o.requestedMode(), normalizedOutput);
    }
}
