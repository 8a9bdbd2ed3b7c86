package org.tensorlatex.symbolic;

/**
 * The elementary functions the translator can produce.
 */
public enum FunctionName {
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    SINH("sinh"),
    COSH("cosh"),
    TANH("tanh"),
    ASIN("asin"),
    ACOS("acos"),
    ATAN("atan"),
    ASINH("asinh"),
    ACOSH("acosh"),
    ATANH("atanh"),
    /** The natural logarithm. */
    LOG("log"),
    EXP("exp");

    private final String display;

    FunctionName(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    /**
     * Returns the inverse of a trigonometric or hyperbolic function.
     * @return The inverse function, e.g. {@link #ASIN} for {@link #SIN}.
     * @throws IllegalStateException if this function has no inverse in this enum.
     */
    public FunctionName inverse() {
        return switch (this) {
            case SIN -> ASIN;
            case COS -> ACOS;
            case TAN -> ATAN;
            case SINH -> ASINH;
            case COSH -> ACOSH;
            case TANH -> ATANH;
            case LOG -> EXP;
            case EXP -> LOG;
            default -> throw new IllegalStateException("No inverse for " + display);
        };
    }

    /**
     * Resolves a LaTeX command name such as {@code "sinh"} to a function.
     * @param command The command without backslash.
     * @return The function.
     * @throws IllegalArgumentException if the command is unknown.
     */
    public static FunctionName fromCommand(String command) {
        for (FunctionName name : values()) {
            if (name.display.equals(command)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown function: " + command);
    }

    double apply(double x) {
        return switch (this) {
            case SIN -> Math.sin(x);
            case COS -> Math.cos(x);
            case TAN -> Math.tan(x);
            case SINH -> Math.sinh(x);
            case COSH -> Math.cosh(x);
            case TANH -> Math.tanh(x);
            case ASIN -> Math.asin(x);
            case ACOS -> Math.acos(x);
            case ATAN -> Math.atan(x);
            case ASINH -> Math.log(x + Math.sqrt(x * x + 1));
            case ACOSH -> Math.log(x + Math.sqrt(x * x - 1));
            case ATANH -> 0.5 * Math.log((1 + x) / (1 - x));
            case LOG -> Math.log(x);
            case EXP -> Math.exp(x);
        };
    }
}
