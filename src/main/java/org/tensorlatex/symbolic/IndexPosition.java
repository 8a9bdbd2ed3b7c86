package org.tensorlatex.symbolic;

/**
 * Vertical position of a tensor index.
 */
public enum IndexPosition {
    /** A superscript (contravariant) index. */
    UPPER('U'),
    /** A subscript (covariant) index. */
    LOWER('D');

    private final char suffix;

    IndexPosition(char suffix) {
        this.suffix = suffix;
    }

    /**
     * The character appended to a tensor's base name for an index in this position.
     * @return {@code 'U'} or {@code 'D'}.
     */
    public char suffix() {
        return suffix;
    }

    public IndexPosition flip() {
        return this == UPPER ? LOWER : UPPER;
    }

    public static IndexPosition fromSuffix(char c) {
        return switch (c) {
            case 'U' -> UPPER;
            case 'D' -> LOWER;
            default -> throw new IllegalArgumentException("Not an index suffix: " + c);
        };
    }
}
