package com.agentite.scene.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * Thrown once per command with every scenetool option problem found.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Problems in the order the options were checked. */
    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() == 1
                ? errors.get(0)
                : errors.size() + " invalid options: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
