package org.tensorlatex.compiler.diagnostics;

/**
 * Raised when no token pattern matches at the current position.
 */
public class LexException extends LatexException {

    public LexException(String message, String sentence, int position) {
        super(message, sentence, position);
    }

    @Override
    public Diagnostic.Kind kind() {
        return Diagnostic.Kind.LEX_ERROR;
    }
}
