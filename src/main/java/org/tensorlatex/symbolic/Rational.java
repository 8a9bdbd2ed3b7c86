package org.tensorlatex.symbolic;

import java.math.BigInteger;
import java.util.Optional;

/**
 * An exact rational number in lowest terms with a positive denominator.
 * Integers are rationals with denominator one.
 *
 * @param numerator   The numerator.
 * @param denominator The denominator, always positive.
 */
public record Rational(BigInteger numerator, BigInteger denominator) implements Numeric {

    public static final Rational ZERO = of(0);
    public static final Rational ONE = of(1);
    public static final Rational MINUS_ONE = of(-1);
    public static final Rational TWO = of(2);
    public static final Rational HALF = of(1, 2);

    // Larger exact powers stay symbolic.
    private static final int MAX_EXACT_BITS = 1 << 16;

    public Rational {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Division by zero in rational " + numerator + "/0");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
    }

    public static Rational of(long value) {
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(long numerator, long denominator) {
        return new Rational(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * Parses a literal of the form {@code "12"} or {@code "3/4"}.
     * @param text The literal text.
     * @return The rational value.
     */
    public static Rational parse(String text) {
        int slash = text.indexOf('/');
        if (slash < 0) {
            return new Rational(new BigInteger(text.trim()), BigInteger.ONE);
        }
        return new Rational(new BigInteger(text.substring(0, slash).trim()), new BigInteger(text.substring(slash + 1).trim()));
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    /**
     * Returns the value as an int. Only meaningful for small integers such as exponents or roots.
     * @return The integer value.
     * @throws ArithmeticException if the value is not an integer that fits into an int.
     */
    public int intValueExact() {
        if (!isInteger()) {
            throw new ArithmeticException(this + " is not an integer");
        }
        return numerator.intValueExact();
    }

    @Override
    public Numeric add(Numeric other) {
        if (other instanceof Rational r) {
            return new Rational(numerator.multiply(r.denominator).add(r.numerator.multiply(denominator)),
                    denominator.multiply(r.denominator));
        }
        return new Decimal(doubleValue() + other.doubleValue());
    }

    @Override
    public Numeric multiply(Numeric other) {
        if (other instanceof Rational r) {
            return new Rational(numerator.multiply(r.numerator), denominator.multiply(r.denominator));
        }
        return new Decimal(doubleValue() * other.doubleValue());
    }

    @Override
    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    @Override
    public Optional<Numeric> pow(Numeric exponent) {
        if (exponent instanceof Decimal d) {
            if (signum() > 0) {
                return Optional.of(new Decimal(Math.pow(doubleValue(), d.value())));
            }
            return Optional.empty();
        }
        Rational e = (Rational) exponent;
        if (e.numerator.bitLength() >= Integer.SIZE || e.denominator.bitLength() >= Integer.SIZE) {
            return Optional.empty();
        }
        int power = e.numerator.intValue();
        if (e.isInteger()) {
            return integerPower(power).map(r -> r);
        }
        int root = e.denominator.intValue();
        if (signum() < 0 && root % 2 == 0) {
            return Optional.empty();
        }
        Optional<BigInteger> num = exactRoot(numerator.abs(), root);
        Optional<BigInteger> den = exactRoot(denominator, root);
        if (num.isEmpty() || den.isEmpty()) {
            return Optional.empty();
        }
        BigInteger signedNum = signum() < 0 ? num.get().negate() : num.get();
        return new Rational(signedNum, den.get()).integerPower(power).map(r -> r);
    }

    private Optional<Rational> integerPower(int exponent) {
        long bits = (long) Math.max(numerator.bitLength(), denominator.bitLength()) * Math.abs((long) exponent);
        if (bits > MAX_EXACT_BITS) {
            return Optional.empty();
        }
        if (exponent >= 0) {
            return Optional.of(new Rational(numerator.pow(exponent), denominator.pow(exponent)));
        }
        if (signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(new Rational(denominator.pow(-exponent), numerator.pow(-exponent)));
    }

    private static Optional<BigInteger> exactRoot(BigInteger value, int root) {
        if (value.signum() == 0 || value.equals(BigInteger.ONE)) {
            return Optional.of(value);
        }
        if (value.bitLength() > 1000 || root >= value.bitLength()) {
            return Optional.empty();
        }
        long guess = Math.round(Math.pow(value.doubleValue(), 1.0 / root));
        for (long candidate = Math.max(1, guess - 1); candidate <= guess + 1; candidate++) {
            if (BigInteger.valueOf(candidate).pow(root).equals(value)) {
                return Optional.of(BigInteger.valueOf(candidate));
            }
        }
        return Optional.empty();
    }

    @Override
    public int signum() {
        return numerator.signum();
    }

    @Override
    public boolean isOne() {
        return numerator.equals(BigInteger.ONE) && denominator.equals(BigInteger.ONE);
    }

    @Override
    public double doubleValue() {
        return numerator.doubleValue() / denominator.doubleValue();
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
