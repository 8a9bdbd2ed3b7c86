package org.tensorlatex.compiler.diagnostics;

/**
 * Raised on a grammar violation: an unexpected token, a missing expected token or an
 * unsupported command.
 */
public class ParseException extends LatexException {

    public ParseException(String message, String sentence, int position) {
        super(message, sentence, position);
    }

    @Override
    public Diagnostic.Kind kind() {
        return Diagnostic.Kind.PARSE_ERROR;
    }
}
