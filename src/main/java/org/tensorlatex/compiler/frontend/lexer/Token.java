package org.tensorlatex.compiler.frontend.lexer;

/**
 * Represents a single token extracted from a LaTeX sentence by the {@link Lexer}.
 *
 * @param type     The type of the token.
 * @param text     The exact text of the token from the sentence.
 * @param position The 0-based character offset where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int position
) {
    /**
     * @return The character offset just past the token.
     */
    public int end() {
        return position + text.length();
    }
}
