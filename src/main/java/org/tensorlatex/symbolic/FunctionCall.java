package org.tensorlatex.symbolic;

/**
 * Application of an elementary function to a single argument.
 * Use {@link Expressions#function} to construct one.
 */
public record FunctionCall(FunctionName function, Expr argument) implements Expr {

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
