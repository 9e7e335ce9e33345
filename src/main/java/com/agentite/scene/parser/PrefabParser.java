package com.agentite.scene.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentite.scene.model.ComponentConfig;
import com.agentite.scene.model.Prefab;
import com.agentite.scene.model.PropValue;
import com.agentite.scene.model.SceneDiagnostics;
import com.agentite.scene.parser.SceneToken.TokenType;
import com.agentite.scene.reflect.ReflectRegistry;

/**
 * Recursive-descent parser for prefab and scene definitions.
 *
 * <pre>
 * entity     := ["Entity"] [name] ["@" "(" number "," number ")"] "{" body "}"
 * body       := (component | child | prefab-ref)*
 * component  := Name ":" (value | "{" (field ":" value [","])* "}")
 * prefab-ref := "prefab" ":" string
 * value      := string | identifier | number | vector
 * vector     := "(" number ("," number){1,3} ")"
 * </pre>
 *
 * Parsing is fail-fast: the first error throws {@link SceneParseException} and no partial
 * tree escapes. The {@code Entity} keyword is optional; headers are told apart from
 * components with one token of lookahead.
 */
public class PrefabParser {
    private static final Logger log = LoggerFactory.getLogger(PrefabParser.class);

    public static final String ENTITY_KEYWORD = "Entity";
    public static final String PREFAB_KEYWORD = "prefab";
    public static final int MAX_VECTOR_COMPONENTS = 4;

    private final SceneLexer lexer;
    private final ReflectRegistry reflect;
    private final SceneDiagnostics diagnostics;

    private SceneToken current;
    private SceneToken previous;

    public PrefabParser(SceneLexer lexer) {
        this(lexer, null, null);
    }

    /**
     * Parser that additionally reports component names unknown to {@code reflect}
     * as warnings in {@code diagnostics}.
     */
    public PrefabParser(SceneLexer lexer, ReflectRegistry reflect, SceneDiagnostics diagnostics) {
        this.lexer = lexer;
        this.reflect = reflect;
        this.diagnostics = diagnostics;
        this.current = lexer.next();
        failOnLexicalError(current);
    }

    /**
     * Parse a source holding exactly one entity.
     */
    public static Prefab parsePrefab(String source, String sourceName) {
        return parsePrefab(source, sourceName, null, null);
    }

    public static Prefab parsePrefab(String source, String sourceName,
                                     ReflectRegistry reflect, SceneDiagnostics diagnostics) {
        try {
            PrefabParser parser = new PrefabParser(new SceneLexer(source, sourceName), reflect, diagnostics);
            Prefab prefab = parser.parseEntity();
            if (!parser.isAtEnd()) {
                throw parser.error("Unexpected content after entity");
            }
            ParseErrors.clear();
            return prefab;
        } catch (SceneParseException e) {
            ParseErrors.record(e.getMessage());
            throw e;
        }
    }

    /**
     * Parse a source holding one or more root entities.
     */
    public static List<Prefab> parseScene(String source, String sourceName) {
        return parseScene(source, sourceName, null, null);
    }

    public static List<Prefab> parseScene(String source, String sourceName,
                                          ReflectRegistry reflect, SceneDiagnostics diagnostics) {
        try {
            PrefabParser parser = new PrefabParser(new SceneLexer(source, sourceName), reflect, diagnostics);
            List<Prefab> roots = parser.parseEntities();
            ParseErrors.clear();
            return roots;
        } catch (SceneParseException e) {
            ParseErrors.record(e.getMessage());
            throw e;
        }
    }

    /**
     * Parse consecutive top-level entity blocks until end of input.
     */
    public List<Prefab> parseEntities() {
        List<Prefab> roots = new ArrayList<>();
        while (!isAtEnd()) {
            if (!check(TokenType.IDENTIFIER) && !check(TokenType.STRING)) {
                throw error("Expected entity name or 'Entity' keyword");
            }
            roots.add(parseEntity());
        }
        if (roots.isEmpty()) {
            throw new SceneParseException(
                    lexer.getSourceName() + ":" + current.getLine() + ":" + current.getColumn()
                            + ": No entities found in '" + lexer.getSourceName() + "'",
                    current.getLine(), current.getColumn());
        }
        log.debug("Parsed {} root entities from {}", roots.size(), lexer.getSourceName());
        return roots;
    }

    /**
     * Parse one entity block starting at the current token.
     */
    public Prefab parseEntity() {
        Prefab prefab = new Prefab();
        parseHeader(prefab);
        expect(TokenType.LBRACE, "Expected '{' after entity header");
        parseBody(prefab);
        expect(TokenType.RBRACE, "Expected '}' after entity body");
        log.debug("Parsed entity {} with {} components and {} children",
                prefab.getName(), prefab.getComponentCount(), prefab.getChildCount());
        return prefab;
    }

    private void parseHeader(Prefab prefab) {
        if (current.isIdentifier(ENTITY_KEYWORD) && startsHeader(lexer.peek())) {
            advance();
        }

        if (check(TokenType.IDENTIFIER) || check(TokenType.STRING)) {
            prefab.setName(advance().getText());
        }

        if (match(TokenType.AT)) {
            expect(TokenType.LPAREN, "Expected '(' after '@'");
            float x = parseFloat();
            expect(TokenType.COMMA, "Expected ',' in position");
            float y = parseFloat();
            expect(TokenType.RPAREN, "Expected ')' after position");
            prefab.setOffset(x, y);
        }
    }

    private static boolean startsHeader(SceneToken token) {
        return switch (token.getType()) {
            case IDENTIFIER, STRING, AT, LBRACE -> true;
            default -> false;
        };
    }

    private void parseBody(Prefab prefab) {
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            if (check(TokenType.IDENTIFIER)) {
                SceneToken following = lexer.peek();
                if (following.getType() == TokenType.COLON) {
                    if (current.isIdentifier(PREFAB_KEYWORD)) {
                        parsePrefabRef(prefab);
                    } else {
                        parseComponent(prefab);
                    }
                } else if (current.isIdentifier(ENTITY_KEYWORD) || startsHeader(following)) {
                    parseChild(prefab);
                } else {
                    advance();
                    throw error("Expected ':' after component name");
                }
            } else if (check(TokenType.STRING) || check(TokenType.AT) || check(TokenType.LBRACE)) {
                parseChild(prefab);
            } else {
                throw error("Expected component name or child entity");
            }
        }
    }

    private void parseChild(Prefab prefab) {
        if (prefab.getChildCount() >= Prefab.MAX_CHILDREN) {
            throw error("Too many child entities (max " + Prefab.MAX_CHILDREN + ")");
        }
        prefab.addChild(parseEntity());
    }

    private void parsePrefabRef(Prefab prefab) {
        advance();
        expect(TokenType.COLON, "Expected ':' after 'prefab'");
        SceneToken path = expect(TokenType.STRING, "Expected string path after 'prefab:'");
        prefab.setBasePrefab(path.getText());
    }

    private void parseComponent(Prefab prefab) {
        if (prefab.getComponentCount() >= Prefab.MAX_COMPONENTS) {
            throw error("Too many components (max " + Prefab.MAX_COMPONENTS + ")");
        }

        SceneToken nameToken = advance();
        String componentName = nameToken.getText();
        expect(TokenType.COLON, "Expected ':' after component name");

        ComponentConfig config;
        if (match(TokenType.LBRACE)) {
            config = new ComponentConfig(componentName);
            while (!check(TokenType.RBRACE) && !isAtEnd()) {
                if (config.isFull()) {
                    throw error("Too many fields in component (max " + ComponentConfig.MAX_FIELDS + ")");
                }
                String fieldName = expect(TokenType.IDENTIFIER, "Expected field name").getText();
                expect(TokenType.COLON, "Expected ':' after field name");
                config.addField(fieldName, parseValue());
                match(TokenType.COMMA);
            }
            expect(TokenType.RBRACE, "Expected '}' after component fields");
        } else {
            config = ComponentConfig.shorthand(componentName, parseValue());
        }

        validateComponent(componentName, nameToken);
        prefab.addComponent(config);
    }

    private void validateComponent(String componentName, SceneToken at) {
        if (reflect == null || diagnostics == null) {
            return;
        }
        if (reflect.getByName(componentName).isEmpty()) {
            diagnostics.warn(lexer.getSourceName() + ":" + at.getLine() + ":" + at.getColumn()
                    + ": Unknown component '" + componentName + "'");
        }
    }

    private PropValue parseValue() {
        if (check(TokenType.STRING)) {
            return PropValue.ofString(advance().getText());
        }
        if (check(TokenType.IDENTIFIER)) {
            String text = advance().getText();
            return switch (text) {
                case "true" -> PropValue.ofBool(true);
                case "false" -> PropValue.ofBool(false);
                default -> PropValue.ofIdentifier(text);
            };
        }
        if (check(TokenType.INT) || check(TokenType.FLOAT) || check(TokenType.MINUS)) {
            return parseNumber();
        }
        if (check(TokenType.LPAREN)) {
            return parseVector();
        }
        throw error("Expected value");
    }

    private PropValue parseVector() {
        advance();
        float[] components = new float[MAX_VECTOR_COMPONENTS];
        int count = 0;
        do {
            if (count >= MAX_VECTOR_COMPONENTS) {
                throw error("Vector has too many components (max " + MAX_VECTOR_COMPONENTS + ")");
            }
            components[count++] = parseFloat();
        } while (match(TokenType.COMMA));

        expect(TokenType.RPAREN, "Expected ')' after vector");
        if (count < 2) {
            throw error("Vector must have 2-4 components");
        }

        float[] exact = new float[count];
        System.arraycopy(components, 0, exact, 0, count);
        return PropValue.ofVector(exact);
    }

    private PropValue parseNumber() {
        boolean negate = match(TokenType.MINUS);
        if (check(TokenType.INT)) {
            long value = advance().getIntValue();
            return PropValue.ofInt(negate ? -value : value);
        }
        if (check(TokenType.FLOAT)) {
            double value = advance().getFloatValue();
            return PropValue.ofFloat(negate ? -value : value);
        }
        throw error("Expected number");
    }

    /**
     * Number narrowed to a float, as stored in positions and vectors.
     */
    private float parseFloat() {
        SceneToken at = current;
        float value = (float) parseNumber().asDouble();
        if (Float.isInfinite(value)) {
            throw errorAt(at, "Number out of float range");
        }
        return value;
    }

    private boolean isAtEnd() {
        return current.getType() == TokenType.EOF;
    }

    private boolean check(TokenType type) {
        return current.getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private SceneToken advance() {
        previous = current;
        if (!isAtEnd()) {
            current = lexer.next();
            failOnLexicalError(current);
        }
        return previous;
    }

    private SceneToken expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void failOnLexicalError(SceneToken token) {
        if (token.getType() == TokenType.ERROR) {
            throw new SceneParseException(token.getText(), token.getLine(), token.getColumn());
        }
    }

    private SceneParseException error(String message) {
        return errorAt(current, message);
    }

    private SceneParseException errorAt(SceneToken at, String message) {
        String found = at.getType() == TokenType.EOF ? "end of input" : "'" + at.getText() + "'";
        String formatted = lexer.getSourceName() + ":" + at.getLine() + ":" + at.getColumn()
                + ": " + message + " (found " + found + ")";
        return new SceneParseException(formatted, at.getLine(), at.getColumn());
    }
}
