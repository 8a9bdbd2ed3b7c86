package org.tensorlatex.compiler.frontend.parser;

import org.tensorlatex.compiler.diagnostics.ParseException;
import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.ast.AssignmentNode;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides directive and command handlers with access to the token stream, the
 * sub-parsers and the session without coupling them directly to the {@link Parser}.
 */
public interface ParsingContext {

    /**
     * Checks if the current token matches the given type. If so, consumes it.
     * @param type The token type to match.
     * @return true if the token was consumed.
     */
    boolean accept(TokenType type);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of a token further ahead without consuming anything.
     * @param offset 0 for the current token, 1 for the next one, and so on.
     * @param type   The token type to check.
     * @return true if the token at {@code offset} is of the given type.
     */
    boolean checkAhead(int offset, TokenType type);

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @return The consumed token.
     * @throws ParseException {@code expected token KIND at position N} if the type does not match.
     */
    Token expect(TokenType type);

    /**
     * Consumes an integer literal used as a count, such as a dimension, an index value, a root
     * or a derivative order.
     * @return The value.
     * @throws ParseException {@code expected token INTEGER at position N} if there is no integer,
     *                        or {@code integer 'X' out of range at position N} if it does not fit an int.
     */
    default int expectInteger() {
        Token token = expect(TokenType.INTEGER);
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw new ParseException(String.format("integer '%s' out of range at position %d", token.text(), token.position()),
                    sentence(), token.position());
        }
    }

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the token at the given distance from the current one.
     * @param offset 0 for the current token.
     * @return The token, or {@link TokenType#END_OF_INPUT} past the end.
     */
    Token peekAhead(int offset);

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Remembers the current position for backtracking.
     * @return A mark to pass to {@link #reset(int)}.
     */
    int mark();

    /**
     * Returns to a position remembered by {@link #mark()}.
     * @param mark The mark.
     */
    void reset(int mark);

    /**
     * Builds the error for a token that cannot appear here.
     * @param token The offending token.
     * @return {@code unexpected 'lexeme' at position N}, or a message naming the end of input.
     */
    ParseException unexpected(Token token);

    /**
     * Parses a full assignment at the current position.
     * @return The assignment.
     */
    AssignmentNode assignment();

    ExpressionParser expressions();

    TensorParser tensors();

    TranslationSession getSession();

    String sentence();
}
