package org.tensorlatex.symbolic;

import java.util.Optional;

/**
 * A floating-point literal such as {@code 0.5}.
 *
 * @param value The numeric value.
 */
public record Decimal(double value) implements Numeric {

    @Override
    public Numeric add(Numeric other) {
        return new Decimal(value + other.doubleValue());
    }

    @Override
    public Numeric multiply(Numeric other) {
        return new Decimal(value * other.doubleValue());
    }

    @Override
    public Numeric negate() {
        return new Decimal(-value);
    }

    @Override
    public Optional<Numeric> pow(Numeric exponent) {
        double result = Math.pow(value, exponent.doubleValue());
        return Double.isNaN(result) ? Optional.empty() : Optional.of(new Decimal(result));
    }

    @Override
    public int signum() {
        return (int) Math.signum(value);
    }

    @Override
    public boolean isOne() {
        return value == 1.0;
    }

    @Override
    public double doubleValue() {
        return value;
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
