package org.tensorlatex.compiler.frontend.lexer;

/**
 * Defines all possible types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Skipped input
    /** Whitespace, thin spaces {@code \,}, empty groups {@code {}} and alignment marks {@code &}. */
    SPACE(true),
    /** Sizing wrappers around delimiters: {@code \left}, {@code \right}, {@code \bigl}, {@code \bigr}. */
    SIZED_DELIMITER(true),

    // Numbers
    /** A rational literal, {@code 3/4} or {@code \frac{3}{4}}. */
    RATIONAL,
    /** A decimal literal, e.g. {@code 0.5}. */
    DECIMAL,
    /** An unsigned integer literal. */
    INTEGER,

    // Constants and operators
    NABLA,
    PI,
    /** A bare {@code e}, Euler's number. */
    EULER,
    PLUS,
    MINUS,
    DIVIDE,
    EQUAL,
    CARET,
    COMMA,
    COLON,
    /** {@code %}, which introduces a configuration line. */
    COMMENT,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_BRACKET,
    RIGHT_BRACKET,

    // Structure
    /** Separator between structures: {@code ;}, {@code \\} or {@code \cr}. */
    LINE_BREAK,
    BEGIN_ALIGN,
    END_ALIGN,

    // Commands
    PARTIAL,
    SQRT_CMD,
    FRAC_CMD,
    /** Trigonometric and hyperbolic functions. */
    TRIG_CMD,
    /** Natural and common logarithm, {@code \ln} and {@code \log}. */
    NLOG_CMD,
    VPHANTOM,

    // Configuration keywords
    DEFINE_MACRO,
    UPDATE_MACRO,
    PARSE_MACRO,
    INDEX_KWRD,
    BASIS_KWRD,
    DERIV_KWRD,
    /** The derivative mode keyword {@code symbolic}. */
    DERIV_TYPE,

    UNDERSCORE,
    /** {@code \hat}, {@code \tilde} or {@code \bar}. */
    DIACRITIC,
    /** A declaration kind or symmetry, e.g. {@code nosym}, {@code metric}, {@code sym01_anti23}. */
    SYMMETRY,
    MATHOP,
    /** A single Latin letter or a Greek letter command. */
    LETTER,
    /** Any other backslash command. */
    COMMAND,

    /** Marks the end of the sentence. */
    END_OF_INPUT;

    private final boolean skipped;

    TokenType() {
        this(false);
    }

    TokenType(boolean skipped) {
        this.skipped = skipped;
    }

    /**
     * Whether tokens of this type are recognized but not passed on to the parser.
     * @return true for whitespace-like tokens.
     */
    public boolean isSkipped() {
        return skipped;
    }
}
