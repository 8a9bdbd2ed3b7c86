package org.tensorlatex.symbolic;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SymbolDifferentiator}.
 */
public class SymbolDifferentiatorTest {

    private static final Symbol R = Expressions.symbol("r");
    private static final Symbol THETA = Expressions.symbol("theta");

    @Test
    @Tag("unit")
    void differentiatesPolynomials() {
        // Arrange
        Expr expr = Expressions.add(Expressions.power(R, 3), Expressions.multiply(Rational.of(5), R), Rational.of(7));

        // Act
        Expr derivative = SymbolDifferentiator.diff(expr, R);

        // Assert
        assertThat(derivative).isEqualTo(Expressions.add(
                Expressions.multiply(Rational.of(3), Expressions.power(R, 2)), Rational.of(5)));
    }

    /**
     * Verifies that other symbols are constants and the chain rule applies inside functions.
     */
    @Test
    @Tag("unit")
    void appliesChainRuleAndTreatsOtherSymbolsAsConstant() {
        // Arrange
        Expr expr = Expressions.multiply(Expressions.power(R, 2), Expressions.function(FunctionName.SIN, THETA));

        // Act
        Expr byR = SymbolDifferentiator.diff(expr, R);
        Expr byTheta = SymbolDifferentiator.diff(expr, THETA);

        // Assert
        assertThat(byR).isEqualTo(Expressions.multiply(Rational.TWO, R, Expressions.function(FunctionName.SIN, THETA)));
        assertThat(byTheta).isEqualTo(Expressions.multiply(Expressions.power(R, 2), Expressions.function(FunctionName.COS, THETA)));
    }

    @Test
    @Tag("unit")
    void differentiatesReciprocal() {
        Expr derivative = SymbolDifferentiator.diff(Expressions.power(R, -1), R);

        assertThat(derivative).isEqualTo(Expressions.negate(Expressions.power(R, -2)));
    }

    @Test
    @Tag("unit")
    void constantsHaveZeroDerivative() {
        assertThat(SymbolDifferentiator.diff(Constant.PI, R)).isEqualTo(Rational.ZERO);
        assertThat(SymbolDifferentiator.diff(THETA, R)).isEqualTo(Rational.ZERO);
    }

    @Test
    @Tag("unit")
    void rejectsUnevaluatedTensorReferences() {
        assertThatThrownBy(() -> SymbolDifferentiator.diff(TensorRef.scalar("h"), R))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unevaluated");
    }
}
