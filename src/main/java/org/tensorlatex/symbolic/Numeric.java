package org.tensorlatex.symbolic;

import java.util.Optional;

/**
 * A numeric literal. Exact arithmetic stays within {@link Rational}; as soon as a
 * {@link Decimal} takes part the result is a decimal.
 */
public sealed interface Numeric extends Expr permits Rational, Decimal {

    Numeric add(Numeric other);

    Numeric multiply(Numeric other);

    Numeric negate();

    /**
     * Raises this number to a numeric power if the result is representable without loss.
     * @param exponent The exponent.
     * @return The power, or empty if it has to stay symbolic (e.g. {@code 2^(1/2)}).
     */
    Optional<Numeric> pow(Numeric exponent);

    int signum();

    boolean isOne();

    double doubleValue();
}
