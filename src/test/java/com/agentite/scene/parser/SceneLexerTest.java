package com.agentite.scene.parser;

import com.agentite.scene.parser.SceneToken.TokenType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SceneLexer.
 */
class SceneLexerTest {

    @Test
    void testTokenizeEntityHeader() {
        List<SceneToken> tokens = new SceneLexer("Player @(10, -20.5) {").tokenize();

        assertThat(tokens).extracting(SceneToken::getType).containsExactly(
                TokenType.IDENTIFIER, TokenType.AT, TokenType.LPAREN, TokenType.INT, TokenType.COMMA,
                TokenType.FLOAT, TokenType.RPAREN, TokenType.LBRACE, TokenType.EOF);
        assertThat(tokens.get(0).getText()).isEqualTo("Player");
        assertThat(tokens.get(3).getIntValue()).isEqualTo(10);
        assertThat(tokens.get(5).getFloatValue()).isEqualTo(-20.5);
    }

    @Test
    void testSkipsBothCommentStyles() {
        String source = """
                # hash comment
                Health: 5 // trailing comment
                // another
                """;

        List<SceneToken> tokens = new SceneLexer(source).tokenize();

        assertThat(tokens).extracting(SceneToken::getType).containsExactly(
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.INT, TokenType.EOF);
        assertThat(tokens.get(0).getLine()).isEqualTo(2);
        assertThat(tokens.get(0).getColumn()).isEqualTo(1);
    }

    @ParameterizedTest
    @CsvSource({
            "42, INT",
            "-7, INT",
            "3.25, FLOAT",
            "1e3, FLOAT",
            "2.5E-2, FLOAT",
            "-0.5, FLOAT"
    })
    void testNumberKinds(String text, TokenType expected) {
        SceneToken token = new SceneLexer(text).next();

        assertThat(token.getType()).isEqualTo(expected);
        assertThat(token.numberValue()).isEqualTo(Double.parseDouble(text));
    }

    @Test
    void testMinusWithoutDigitIsSymbol() {
        List<SceneToken> tokens = new SceneLexer("- x").tokenize();

        assertThat(tokens).extracting(SceneToken::getType)
                .containsExactly(TokenType.MINUS, TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void testStringEscapesAreDecoded() {
        SceneToken token = new SceneLexer("\"a \\\"quoted\\\" line\\nnext\\\\\"").next();

        assertThat(token.getType()).isEqualTo(TokenType.STRING);
        assertThat(token.getText()).isEqualTo("a \"quoted\" line\nnext\\");
    }

    @Test
    void testUnterminatedStringReportsPosition() {
        SceneLexer lexer = new SceneLexer("Name: \"open", "player.prefab");

        lexer.next();
        lexer.next();
        SceneToken token = lexer.next();

        assertThat(token.getType()).isEqualTo(TokenType.ERROR);
        assertThat(token.getText()).isEqualTo("player.prefab:1:7: Unterminated string");
        assertThat(lexer.hasError()).isTrue();
        assertThat(lexer.next().getType()).isEqualTo(TokenType.EOF);
    }

    @Test
    void testUnexpectedCharacter() {
        SceneLexer lexer = new SceneLexer("a ; b");

        lexer.next();
        SceneToken error = lexer.next();

        assertThat(error.getType()).isEqualTo(TokenType.ERROR);
        assertThat(error.getText()).isEqualTo("<source>:1:3: Unexpected character ';'");
        assertThat(lexer.next().getText()).isEqualTo("b");
        assertThat(lexer.getErrorMessage()).contains("Unexpected character");
    }

    @Test
    void testInvalidExponent() {
        SceneToken token = new SceneLexer("1e+").next();

        assertThat(token.getType()).isEqualTo(TokenType.ERROR);
        assertThat(token.getText()).endsWith("Invalid number exponent");
    }

    @ParameterizedTest
    @ValueSource(strings = { "1e999", "-2.5e400" })
    void testFloatOutOfRange(String literal) {
        SceneToken token = new SceneLexer(literal, "big.prefab").next();

        assertThat(token.getType()).isEqualTo(TokenType.ERROR);
        assertThat(token.getText()).isEqualTo("big.prefab:1:1: Float literal out of range: " + literal);
    }

    @Test
    void testPeekDoesNotConsume() {
        SceneLexer lexer = new SceneLexer("alpha beta");

        assertThat(lexer.peek().getText()).isEqualTo("alpha");
        assertThat(lexer.peek().getText()).isEqualTo("alpha");
        assertThat(lexer.next().getText()).isEqualTo("alpha");
        assertThat(lexer.peek().getText()).isEqualTo("beta");
        assertThat(lexer.next().getColumn()).isEqualTo(7);
    }

    @Test
    void testIsIdentifier() {
        assertThat(SceneLexer.isIdentifier("Player_1")).isTrue();
        assertThat(SceneLexer.isIdentifier("_hidden")).isTrue();
        assertThat(SceneLexer.isIdentifier("1st")).isFalse();
        assertThat(SceneLexer.isIdentifier("two words")).isFalse();
        assertThat(SceneLexer.isIdentifier("")).isFalse();
    }
}
