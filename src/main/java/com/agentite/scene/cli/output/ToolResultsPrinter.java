package com.agentite.scene.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log output of the scenetool commands. No validation, no execution.
 */
public class ToolResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ToolResultsPrinter.class);

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  - {}", error);
        }
    }

    public void printCheckSummary(List<FileReport> reports) {
        long failed = reports.stream().filter(r -> !r.isSuccess()).count();
        if (failed == 0) {
            log.info("Checked {} file(s), all passed", reports.size());
        } else {
            log.warn("Checked {} file(s), {} failed", reports.size(), failed);
        }
    }

    public void printFormatted(Path input, Path output) {
        log.info("Formatted {} -> {}", input, output);
    }

    public void printFailure(Path input, String message) {
        log.error("Failed to process {}: {}", input, message);
    }
}
