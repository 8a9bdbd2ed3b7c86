package org.tensorlatex.compiler.diagnostics;

/**
 * Base class of the errors raised inside the translator. They unwind one structure
 * (a configuration line or an assignment) and are then recorded as {@link Diagnostic}s.
 */
public abstract class LatexException extends RuntimeException {

    private final String sentence;
    private final int position;

    protected LatexException(String message, String sentence, int position) {
        super(message);
        this.sentence = sentence;
        this.position = position;
    }

    protected LatexException(String message, String sentence, int position, Throwable cause) {
        super(message, cause);
        this.sentence = sentence;
        this.position = position;
    }

    /**
     * The diagnostic kind this error is reported as.
     * @return The kind.
     */
    public abstract Diagnostic.Kind kind();

    public String sentence() {
        return sentence;
    }

    /**
     * @return 0-based character offset, or -1 if the error is not tied to a position.
     */
    public int position() {
        return position;
    }

    /**
     * @return The caret-style position indicator.
     */
    public String indicator() {
        return Diagnostic.indicator(sentence, position);
    }
}
