package com.agentite.scene.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token produced by the scene lexer.
 *
 * For INT and FLOAT tokens the parsed numeric value is carried alongside the text;
 * for ERROR tokens the text holds the formatted error message.
 */
@Data
@AllArgsConstructor
public class SceneToken {
    private TokenType type;
    private String text;
    private int line;
    private int column;
    private long intValue;
    private double floatValue;

    public SceneToken(TokenType type, String text, int line, int column) {
        this(type, text, line, column, 0L, 0.0);
    }

    public enum TokenType {
        EOF("EOF"),
        ERROR("ERROR"),
        IDENTIFIER("IDENTIFIER"),
        STRING("STRING"),
        INT("INT"),
        FLOAT("FLOAT"),
        AT("@"),
        LPAREN("("),
        RPAREN(")"),
        LBRACE("{"),
        RBRACE("}"),
        COLON(":"),
        COMMA(","),
        MINUS("-");

        private final String display;

        TokenType(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public boolean isNumber() {
        return type == TokenType.INT || type == TokenType.FLOAT;
    }

    public boolean isIdentifier(String word) {
        return type == TokenType.IDENTIFIER && text.equals(word);
    }

    /**
     * Numeric value of an INT or FLOAT token as a double.
     */
    public double numberValue() {
        return type == TokenType.INT ? intValue : floatValue;
    }
}
