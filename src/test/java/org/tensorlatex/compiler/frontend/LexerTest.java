package org.tensorlatex.compiler.frontend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tensorlatex.compiler.diagnostics.LexException;
import org.tensorlatex.compiler.frontend.lexer.Lexer;
import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenPatternRegistry;
import org.tensorlatex.compiler.frontend.lexer.TokenType;

import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer turns LaTeX sentences into the expected token stream,
 * honoring the pattern precedence and dropping whitespace-like input.
 * These are unit tests and do not require external resources.
 */
public class LexerTest {

    /**
     * Verifies the token types and texts of a simple assignment, including a {@code \frac}
     * literal that must be read as one rational number.
     */
    @Test
    @Tag("unit")
    void testAssignmentTokenization() {
        // Arrange
        Lexer lexer = new Lexer("y = x^{2} + \\frac{1}{2}");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LETTER, TokenType.EQUAL, TokenType.LETTER, TokenType.CARET, TokenType.LEFT_BRACE,
                TokenType.INTEGER, TokenType.RIGHT_BRACE, TokenType.PLUS, TokenType.RATIONAL, TokenType.END_OF_INPUT);
        assertThat(tokens.get(8).text()).isEqualTo("\\frac{1}{2}");
        assertThat(tokens.get(9).position()).isEqualTo(23);
    }

    /**
     * A command must never match a prefix of a longer command.
     */
    @Test
    @Tag("unit")
    void testCommandDoesNotMatchPrefixOfLongerCommand() {
        // Act
        List<Token> tokens = new Lexer("\\sinh\\sin\\pi\\phi").scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.TRIG_CMD, "\\sinh"),
                tuple(TokenType.TRIG_CMD, "\\sin"),
                tuple(TokenType.PI, "\\pi"),
                tuple(TokenType.LETTER, "\\phi"),
                tuple(TokenType.END_OF_INPUT, ""));
    }

    @Test
    @Tag("unit")
    void testSizingCommandsAndSpacesAreSkipped() {
        // Act
        List<Token> tokens = new Lexer("\\left( a \\, b \\right)").scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LEFT_PAREN, TokenType.LETTER, TokenType.LETTER, TokenType.RIGHT_PAREN, TokenType.END_OF_INPUT);
        assertThat(tokens).extracting(Token::position).containsExactly(5, 7, 12, 20, 21);
    }

    /**
     * Verifies that a bare {@code e} is Euler's number, while {@code e} inside a keyword is not.
     */
    @Test
    @Tag("unit")
    void testEulerAndKeywords() {
        // Act
        List<Token> tokens = new Lexer("% define nosym hUD (4); e").scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.COMMENT, TokenType.DEFINE_MACRO, TokenType.SYMMETRY, TokenType.LETTER, TokenType.LETTER,
                TokenType.LETTER, TokenType.LEFT_PAREN, TokenType.INTEGER, TokenType.RIGHT_PAREN, TokenType.LINE_BREAK,
                TokenType.EULER, TokenType.END_OF_INPUT);
    }

    /**
     * Verifies that {@code e} next to other letters is still Euler's number, on either side.
     */
    @Test
    @Tag("unit")
    void testEulerInsideImplicitProduct() {
        // Act
        List<Token> tokens = new Lexer("ex - xe").scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.EULER, "e"),
                tuple(TokenType.LETTER, "x"),
                tuple(TokenType.MINUS, "-"),
                tuple(TokenType.LETTER, "x"),
                tuple(TokenType.EULER, "e"),
                tuple(TokenType.END_OF_INPUT, ""));
    }

    @Test
    @Tag("unit")
    void testLineBreakVariants() {
        List<Token> tokens = new Lexer("a \\\\ b ; c \\cr").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LETTER, TokenType.LINE_BREAK, TokenType.LETTER, TokenType.LINE_BREAK,
                TokenType.LETTER, TokenType.LINE_BREAK, TokenType.END_OF_INPUT);
    }

    /**
     * Verifies that tokenizing is lazy: the error only surfaces when the stream reaches it,
     * and {@link Lexer#recover()} lets it go on past the offending character.
     */
    @Test
    @Tag("unit")
    void testUnexpectedCharacterIsReportedLazily() {
        // Arrange
        Lexer lexer = new Lexer("x # y");
        Iterator<Token> stream = lexer.tokenize();

        // Act
        Token first = stream.next();

        // Assert
        assertThat(first.type()).isEqualTo(TokenType.LETTER);
        assertThatThrownBy(stream::next)
                .isInstanceOf(LexException.class)
                .hasMessage("unexpected character '#' at position 2")
                .satisfies(e -> assertThat(((LexException) e).position()).isEqualTo(2));

        lexer.recover();
        assertThat(stream.next()).extracting(Token::type, Token::text).containsExactly(TokenType.LETTER, "y");
    }

    /**
     * Verifies that the registry can be extended without changing the built-in patterns.
     */
    @Test
    @Tag("unit")
    void testRegistryExtension() {
        // Arrange
        TokenPatternRegistry registry = TokenPatternRegistry.defaults()
                .registerBefore(TokenType.COMMAND, TokenType.NABLA, "\\\\grad(?![a-zA-Z])");

        // Act
        List<Token> extended = new Lexer("\\grad_a", registry).scanTokens();
        List<Token> plain = new Lexer("\\grad_a").scanTokens();

        // Assert
        assertThat(extended.get(0).type()).isEqualTo(TokenType.NABLA);
        assertThat(plain.get(0).type()).isEqualTo(TokenType.COMMAND);
        assertThatThrownBy(() -> TokenPatternRegistry.defaults().registerBefore(TokenType.END_OF_INPUT, TokenType.NABLA, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
