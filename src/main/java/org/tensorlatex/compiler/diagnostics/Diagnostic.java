package org.tensorlatex.compiler.diagnostics;

/**
 * Represents a single diagnostic message produced while translating a LaTeX sentence.
 *
 * @param kind     What went wrong (lexing, parsing, tensor semantics) or which warning applies.
 * @param message  The diagnostic message.
 * @param sentence The sentence the position refers to.
 * @param position 0-based character offset into {@code sentence}, or -1 if unknown.
 */
public record Diagnostic(
        Kind kind,
        String message,
        String sentence,
        int position
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** An error that stops the structure it occurred in. */
        ERROR,
        /** A warning that does not prevent translation. */
        WARNING
    }

    /**
     * The error taxonomy of the translator.
     */
    public enum Kind {
        /** No token pattern matches at a position. */
        LEX_ERROR("LexError", Type.ERROR),
        /** Grammar violation: unexpected token, missing expected token, unsupported command. */
        PARSE_ERROR("ParseError", Type.ERROR),
        /** Summation convention violation, dimension mismatch, undefined tensor or metric. */
        TENSOR_ERROR("TensorError", Type.ERROR),
        /** An existing name was declared again. */
        OVERRIDE_WARNING("OverrideWarning", Type.WARNING);

        private final String label;
        private final Type type;

        Kind(String label, Type type) {
            this.label = label;
            this.type = type;
        }

        public String label() {
            return label;
        }

        public Type type() {
            return type;
        }
    }

    public Type type() {
        return kind.type();
    }

    /**
     * Renders the line of the sentence containing the position with a caret below the offending
     * character, suitable for terminal display.
     * @return The two-line indicator, or an empty string if the position is unknown.
     */
    public String indicator() {
        return indicator(sentence, position);
    }

    /**
     * Renders a caret indicator for an arbitrary sentence and position.
     * @param sentence The sentence.
     * @param position 0-based character offset; may equal the sentence length for "end of input".
     * @return The line containing the position followed by a caret line.
     */
    public static String indicator(String sentence, int position) {
        if (sentence == null || position < 0) {
            return "";
        }
        int clamped = Math.min(position, sentence.length());
        int lineStart = sentence.lastIndexOf('\n', clamped - 1) + 1;
        int lineEnd = sentence.indexOf('\n', clamped);
        String line = sentence.substring(lineStart, lineEnd < 0 ? sentence.length() : lineEnd);
        return line + "\n" + " ".repeat(clamped - lineStart) + "^";
    }

    @Override
    public String toString() {
        String header = String.format("[%s] %s: %s", type(), kind.label(), message);
        String caret = indicator();
        return caret.isEmpty() ? header : header + "\n" + caret;
    }
}
