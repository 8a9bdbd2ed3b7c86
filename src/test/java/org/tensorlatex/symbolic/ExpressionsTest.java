package org.tensorlatex.symbolic;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link Expressions}, the factory that keeps expressions in canonical form.
 * Two expressions that are equal after simplification must be equal under {@code equals}.
 */
public class ExpressionsTest {

    private static final Symbol X = Expressions.symbol("x");
    private static final Symbol Y = Expressions.symbol("y");

    /**
     * Verifies that like terms are collected into a single scaled term.
     */
    @Test
    @Tag("unit")
    void addCollectsLikeTerms() {
        // Act
        Expr sum = Expressions.add(X, X, Y);

        // Assert
        assertThat(sum).isEqualTo(Expressions.add(Expressions.multiply(Rational.TWO, X), Y));
        assertThat(ExprPrinter.print(sum)).isEqualTo("2*x + y");
    }

    @Test
    @Tag("unit")
    void addCancelsToZero() {
        Expr sum = Expressions.add(X, Expressions.negate(X));

        assertThat(sum.isZero()).isTrue();
    }

    /**
     * Verifies that nested sums are flattened and their numbers folded, independent of argument order.
     */
    @Test
    @Tag("unit")
    void addFlattensAndIsOrderIndependent() {
        // Arrange
        Expr left = Expressions.add(Expressions.add(X, Rational.ONE), Expressions.add(Y, Rational.TWO));
        Expr right = Expressions.add(Y, Rational.of(3), X);

        // Assert
        assertThat(left).isEqualTo(right);
        assertThat(ExprPrinter.print(left)).isEqualTo("3 + x + y");
    }

    @Test
    @Tag("unit")
    void multiplyMergesEqualBases() {
        Expr product = Expressions.multiply(X, Y, X);

        assertThat(product).isEqualTo(Expressions.multiply(Expressions.power(X, 2), Y));
    }

    @Test
    @Tag("unit")
    void multiplyByZeroIsZero() {
        assertThat(Expressions.multiply(X, Rational.ZERO, Y)).isEqualTo(Rational.ZERO);
    }

    /**
     * Verifies that a quotient of a symbol by itself cancels and integer powers of powers combine.
     */
    @Test
    @Tag("unit")
    void divideAndNestedPowersSimplify() {
        assertThat(Expressions.divide(X, X)).isEqualTo(Rational.ONE);
        assertThat(Expressions.power(Expressions.power(X, 2), 3)).isEqualTo(Expressions.power(X, 6));
    }

    @Test
    @Tag("unit")
    void exactRootsOfRationalsAreEvaluated() {
        assertThat(Expressions.sqrt(Rational.of(4))).isEqualTo(Rational.TWO);
        assertThat(Expressions.power(Rational.of(8, 27), Rational.of(1, 3))).isEqualTo(Rational.of(2, 3));
        assertThat(Expressions.sqrt(Rational.TWO)).isInstanceOf(Power.class);
    }

    @Test
    @Tag("unit")
    void functionsFoldExactArguments() {
        assertThat(Expressions.function(FunctionName.SIN, Rational.ZERO)).isEqualTo(Rational.ZERO);
        assertThat(Expressions.function(FunctionName.COS, Rational.ZERO)).isEqualTo(Rational.ONE);
        assertThat(Expressions.function(FunctionName.LOG, Constant.E)).isEqualTo(Rational.ONE);
        assertThat(Expressions.function(FunctionName.SIN, X)).isEqualTo(new FunctionCall(FunctionName.SIN, X));
    }

    /**
     * Verifies the infix rendering of a compound power, the shape produced by {@code (1 + x/n)^n}.
     */
    @Test
    @Tag("unit")
    void printerRendersQuotientsAndPowers() {
        // Arrange
        Symbol n = Expressions.symbol("n");
        Expr expr = Expressions.power(Expressions.add(Rational.ONE, Expressions.divide(X, n)), n);

        // Act
        String printed = ExprPrinter.print(expr);

        // Assert
        assertThat(printed).isEqualTo("(1 + x/n)**n");
    }

    @Test
    @Tag("unit")
    void containsFindsNestedSymbols() {
        Expr expr = Expressions.function(FunctionName.SIN, Expressions.multiply(X, Y));

        assertThat(Expressions.contains(expr, Y)).isTrue();
        assertThat(Expressions.contains(expr, Expressions.symbol("z"))).isFalse();
    }
}
