package org.tensorlatex.compiler.frontend.semantics.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tensorlatex.compiler.Translator;
import org.tensorlatex.compiler.api.ParseResult;
import org.tensorlatex.compiler.config.SessionConfig;
import org.tensorlatex.compiler.diagnostics.Diagnostic;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.ExprPrinter;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.Rational;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains tests for the {@link IndexEngine}, driven through the {@link Translator}.
 * They cover the summation convention, component expansion and the use of declared symmetries.
 */
public class IndexEngineTest {

    private Translator translator;
    private TranslationSession session;

    @BeforeEach
    void setUp() {
        translator = new Translator();
        session = new TranslationSession(SessionConfig.defaults());
    }

    private static Expr sym(String name) {
        return Expressions.symbol(name);
    }

    private static List<String> keysStartingWith(ParseResult result, String prefix) {
        return result.bindings().keySet().stream().filter(key -> key.startsWith(prefix)).collect(Collectors.toList());
    }

    /**
     * Verifies that a repeated upper/lower label is summed over the declared dimension.
     */
    @Test
    @Tag("unit")
    void testTraceIsSummed() {
        // Act
        ParseResult result = translator.parse("% define nosym hUD (4); h = h^\\mu{}_\\mu", session);

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(ExprPrinter.print(result.bindings().get("h"))).isEqualTo("hUD00 + hUD11 + hUD22 + hUD33");
    }

    /**
     * Verifies that a free label on the left produces one equation per component, and the
     * bound label on the right an explicit sum for each of them.
     */
    @Test
    @Tag("unit")
    void testIndexLoweringWithMetric() {
        // Act
        ParseResult result = translator.parse(
                "% define metric gUU (3); % define nosym vD (3); v^\\mu = g^{\\mu\\nu} v_\\nu", session);

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(keysStartingWith(result, "vU")).containsExactly("vU0", "vU1", "vU2");
        assertThat(result.bindings().get("vU1")).isEqualTo(Expressions.add(
                Expressions.multiply(sym("gUU01"), sym("vD0")),
                Expressions.multiply(sym("gUU11"), sym("vD1")),
                Expressions.multiply(sym("gUU12"), sym("vD2"))));
    }

    /**
     * Components of a rank-2 target come out in row-major order, first index outermost.
     */
    @Test
    @Tag("unit")
    void testComponentsInRowMajorOrder() {
        // Act
        ParseResult result = translator.parse(
                "% define nosym AUD (2), nosym BUD (2); C^{a}_{b} = A^{a}_{c} B^{c}_{b}", session);

        // Assert
        assertThat(keysStartingWith(result, "CUD")).containsExactly("CUD00", "CUD01", "CUD10", "CUD11");
        assertThat(result.bindings().get("CUD01")).isEqualTo(Expressions.add(
                Expressions.multiply(sym("AUD00"), sym("BUD01")),
                Expressions.multiply(sym("AUD01"), sym("BUD11"))));
    }

    @Test
    @Tag("unit")
    void testConcreteComponentAccess() {
        ParseResult result = translator.parse("% define nosym TDD (3); T_{1 2} = 7; x = T_{12} + T_{21}", session);

        assertThat(result.hasErrors()).isFalse();
        assertThat(ExprPrinter.print(result.bindings().get("x"))).isEqualTo("7 + TDD21");
    }

    /**
     * Verifies that an antisymmetric target only evaluates its independent components and
     * fills the others by negation.
     */
    @Test
    @Tag("unit")
    void testAntisymmetricTarget() {
        // Act
        ParseResult result = translator.parse(
                "% define anti01 FDD (3), nosym AD (3), nosym BD (3); F_{a b} = A_{a} B_{b} - A_{b} B_{a}", session);

        // Assert
        Expr f01 = Expressions.subtract(Expressions.multiply(sym("AD0"), sym("BD1")),
                Expressions.multiply(sym("AD1"), sym("BD0")));
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.bindings().get("FDD01")).isEqualTo(f01);
        assertThat(result.bindings().get("FDD10")).isEqualTo(Expressions.negate(f01));
        assertThat(result.bindings().get("FDD00")).isEqualTo(Rational.ZERO);
    }

    @Test
    @Tag("unit")
    void testSymmetricDeclarationSharesComponents() {
        ParseResult result = translator.parse("% define sym01 hDD (2)", session);

        assertThat(ExprPrinter.print(result.bindings().get("hDD10"))).isEqualTo("hDD01");
        assertThat(ExprPrinter.print(result.bindings().get("hDD01"))).isEqualTo("hDD01");
    }

    /**
     * The Kronecker delta and the permutation symbol need no right-hand side values.
     */
    @Test
    @Tag("unit")
    void testKroneckerAndPermutation() {
        // Act
        ParseResult result = translator.parse(
                "% define kronecker deltaUD (3), permutation epsilonDDD (3), nosym vU (3); "
                        + "w^a = \\delta^a_b v^b; s = \\epsilon_{0 1 2} + \\epsilon_{1 0 2} + \\epsilon_{0 0 1}", session);

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.binding("epsilonDDD120")).contains(Rational.ONE);
        assertThat(result.binding("epsilonDDD021")).contains(Rational.MINUS_ONE);
        assertThat(result.bindings().get("wU2")).isEqualTo(sym("vU2"));
        assertThat(result.binding("s")).contains(Rational.ZERO);
    }

    @Test
    @Tag("unit")
    void testIllegalBoundIndex() {
        ParseResult result = translator.parse("% define nosym vU (3); s = v^a v^a", session);

        assertThat(result.errors()).singleElement()
                .extracting(Diagnostic::kind, Diagnostic::message, Diagnostic::position)
                .containsExactly(Diagnostic.Kind.TENSOR_ERROR, "illegal bound index 'a'", 23);
    }

    /**
     * Three equal factors merge into a cube of one reference; the label still counts three times.
     */
    @Test
    @Tag("unit")
    void testIndexRepeatedThreeTimesIsIllegal() {
        ParseResult result = translator.parse("% define nosym vU (3); s = v^a v^a v^a", session);

        assertThat(result.errors()).singleElement()
                .extracting(Diagnostic::kind, Diagnostic::message)
                .containsExactly(Diagnostic.Kind.TENSOR_ERROR, "illegal bound index 'a'");
    }

    /**
     * A contraction raised to a power is summed inside the base before the power is taken.
     */
    @Test
    @Tag("unit")
    void testPowerOfContraction() {
        // Arrange
        Expr contraction = Expressions.add(
                Expressions.multiply(Expressions.symbol("vU0"), Expressions.symbol("wD0")),
                Expressions.multiply(Expressions.symbol("vU1"), Expressions.symbol("wD1")),
                Expressions.multiply(Expressions.symbol("vU2"), Expressions.symbol("wD2")));

        // Act
        ParseResult result = translator.parse(
                "% define nosym vU (3), nosym wD (3); s = (v^a w_a)^2; t = (v^a w_a)^{{2}}", session);

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.binding("s")).contains(Expressions.power(contraction, 2));
        assertThat(result.binding("t")).contains(Expressions.power(contraction, 2));
    }

    @Test
    @Tag("unit")
    void testIllegalBoundIndexOnLeftHandSide() {
        ParseResult result = translator.parse("% define nosym vU (3); T_{a a} = 0", session);

        assertThat(result.errors()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("illegal bound index 'a' on left-hand side");
    }

    /**
     * Every term of a sum must carry the same free labels as the left-hand side.
     */
    @Test
    @Tag("unit")
    void testUnbalancedFreeIndex() {
        ParseResult betweenTerms = translator.parse("% define nosym vU (3), nosym wU (3); u^a = v^a + w^b", session);
        ParseResult againstTarget = translator.parse("u^a = v^b", session);

        assertThat(betweenTerms.errors()).extracting(Diagnostic::message).containsExactly("unbalanced free index");
        assertThat(againstTarget.errors()).extracting(Diagnostic::message).containsExactly("unbalanced free index");
    }

    @Test
    @Tag("unit")
    void testDimensionMismatch() {
        ParseResult result = translator.parse("% define nosym vU (3), nosym wD (2); s = v^a w_a", session);

        assertThat(result.errors()).extracting(Diagnostic::message).containsExactly("dimension mismatch for index 'a'");
    }

    @Test
    @Tag("unit")
    void testComponentOutOfRange() {
        ParseResult result = translator.parse("% define nosym vU (2); x = v^{5}", session);

        assertThat(result.errors()).extracting(Diagnostic::message)
                .containsExactly("index 5 out of range for 'vU' of dimension 2");
    }

    /**
     * An index range restricts a free label; components outside it keep their earlier value.
     */
    @Test
    @Tag("unit")
    void testIndexRangeRestrictsFreeLabel() {
        // Act
        ParseResult result = translator.parse(
                "% define nosym vU (4); % define index [i-k] = 1:3; w^i = 2 v^i", session);

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(keysStartingWith(result, "wU")).containsExactly("wU1", "wU2", "wU3");
        assertThat(ExprPrinter.print(result.bindings().get("wU3"))).isEqualTo("2*vU3");
        assertThat(session.namespace().value("wU0")).contains(Rational.ZERO);
    }

    @Test
    @Tag("unit")
    void testFreeIndexInExpression() {
        translator.parse("% define nosym vU (2)", session);

        ParseResult result = translator.parseExpression("v^a", session);

        assertThat(result.expression()).isNull();
        assertThat(result.errors()).extracting(Diagnostic::message).containsExactly("free index in expression: 'a'");
    }
}
