package com.agentite.scene.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentite.scene.parser.SceneToken.TokenType;

/**
 * Lexer for prefab and scene definition sources.
 *
 * Tokens are produced lazily by {@link #next()}; {@link #peek()} looks one token ahead
 * by saving and restoring the scan position. Whitespace, {@code //} and {@code #} line
 * comments are skipped.
 *
 * A lexical error yields a single ERROR token whose text is {@code name:line:col: message}.
 * The lexer remembers the first error but keeps answering further calls.
 */
public class SceneLexer {
    private static final Logger log = LoggerFactory.getLogger(SceneLexer.class);

    public static final String DEFAULT_SOURCE_NAME = "<source>";

    private final String source;
    private final String sourceName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    private String errorMessage;

    public SceneLexer(String source, String sourceName) {
        this.source = source != null ? source : "";
        this.sourceName = sourceName != null ? sourceName : DEFAULT_SOURCE_NAME;
    }

    public SceneLexer(String source) {
        this(source, null);
    }

    public String getSourceName() {
        return sourceName;
    }

    public boolean hasError() {
        return errorMessage != null;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Tokenize the whole source. The list ends with the EOF token, or with the first ERROR token.
     */
    public List<SceneToken> tokenize() {
        List<SceneToken> tokens = new ArrayList<>();
        while (true) {
            SceneToken token = next();
            tokens.add(token);
            if (token.getType() == TokenType.EOF || token.getType() == TokenType.ERROR) {
                break;
            }
        }
        log.debug("Tokenized {}: {} tokens", sourceName, tokens.size());
        return tokens;
    }

    /**
     * Return the next token without consuming it.
     */
    public SceneToken peek() {
        int savedPos = pos;
        int savedLine = line;
        int savedColumn = column;
        String savedError = errorMessage;

        SceneToken token = next();

        pos = savedPos;
        line = savedLine;
        column = savedColumn;
        errorMessage = savedError;
        return token;
    }

    /**
     * Scan and consume the next token.
     */
    public SceneToken next() {
        skipWhitespaceAndComments();

        if (isAtEnd()) {
            return new SceneToken(TokenType.EOF, "", line, column);
        }

        int startLine = line;
        int startColumn = column;
        char c = current();

        if (isIdentifierStart(c)) {
            return scanIdentifier(startLine, startColumn);
        }
        if (isDigit(c)) {
            return scanNumber(startLine, startColumn);
        }
        if (c == '-' && isDigit(lookahead(1))) {
            return scanNumber(startLine, startColumn);
        }
        if (c == '"') {
            return scanString(startLine, startColumn);
        }

        TokenType symbol = switch (c) {
            case '@' -> TokenType.AT;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case ':' -> TokenType.COLON;
            case ',' -> TokenType.COMMA;
            case '-' -> TokenType.MINUS;
            default -> null;
        };

        if (symbol == null) {
            advance();
            return error("Unexpected character '" + c + "'", startLine, startColumn);
        }

        advance();
        return new SceneToken(symbol, String.valueOf(c), startLine, startColumn);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = current();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '#' || (c == '/' && lookahead(1) == '/')) {
                while (!isAtEnd() && current() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private SceneToken scanIdentifier(int startLine, int startColumn) {
        int start = pos;
        while (!isAtEnd() && isIdentifierPart(current())) {
            advance();
        }
        return new SceneToken(TokenType.IDENTIFIER, source.substring(start, pos), startLine, startColumn);
    }

    private SceneToken scanNumber(int startLine, int startColumn) {
        int start = pos;
        boolean isFloat = false;

        if (current() == '-') {
            advance();
        }
        while (!isAtEnd() && isDigit(current())) {
            advance();
        }

        if (!isAtEnd() && current() == '.' && isDigit(lookahead(1))) {
            isFloat = true;
            advance();
            while (!isAtEnd() && isDigit(current())) {
                advance();
            }
        }

        if (!isAtEnd() && (current() == 'e' || current() == 'E')) {
            isFloat = true;
            advance();
            if (!isAtEnd() && (current() == '+' || current() == '-')) {
                advance();
            }
            if (isAtEnd() || !isDigit(current())) {
                return error("Invalid number exponent", startLine, startColumn);
            }
            while (!isAtEnd() && isDigit(current())) {
                advance();
            }
        }

        String text = source.substring(start, pos);
        if (isFloat) {
            double value = Double.parseDouble(text);
            if (Double.isInfinite(value)) {
                return error("Float literal out of range: " + text, startLine, startColumn);
            }
            return new SceneToken(TokenType.FLOAT, text, startLine, startColumn, 0L, value);
        }
        try {
            long value = Long.parseLong(text);
            return new SceneToken(TokenType.INT, text, startLine, startColumn, value, value);
        } catch (NumberFormatException e) {
            return error("Integer literal out of range: " + text, startLine, startColumn);
        }
    }

    private SceneToken scanString(int startLine, int startColumn) {
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && current() != '"') {
            char c = current();
            if (c == '\\' && pos + 1 < source.length()) {
                advance();
                char escaped = current();
                sb.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> escaped;
                });
                advance();
            } else {
                sb.append(c);
                advance();
            }
        }

        if (isAtEnd()) {
            return error("Unterminated string", startLine, startColumn);
        }

        advance(); // closing quote
        return new SceneToken(TokenType.STRING, sb.toString(), startLine, startColumn);
    }

    private SceneToken error(String message, int errorLine, int errorColumn) {
        String formatted = sourceName + ":" + errorLine + ":" + errorColumn + ": " + message;
        if (errorMessage == null) {
            errorMessage = formatted;
        }
        log.debug("Lexical error: {}", formatted);
        return new SceneToken(TokenType.ERROR, formatted, errorLine, errorColumn);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char current() {
        return source.charAt(pos);
    }

    private char lookahead(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    /**
     * Check whether the text is a valid bare identifier.
     */
    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || !isIdentifierStart(text.charAt(0))) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            if (!isIdentifierPart(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
