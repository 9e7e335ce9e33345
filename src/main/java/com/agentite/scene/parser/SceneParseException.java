package com.agentite.scene.parser;

import lombok.Getter;

/**
 * Raised on the first lexical or syntactic error of a parse.
 * The message is already formatted as {@code name:line:col: message}.
 */
@Getter
public class SceneParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public SceneParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }
}
