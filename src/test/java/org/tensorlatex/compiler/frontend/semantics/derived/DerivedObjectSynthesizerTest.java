package org.tensorlatex.compiler.frontend.semantics.derived;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tensorlatex.compiler.Translator;
import org.tensorlatex.compiler.api.ParseResult;
import org.tensorlatex.compiler.api.TranslationException;
import org.tensorlatex.compiler.config.SessionConfig;
import org.tensorlatex.compiler.diagnostics.Diagnostic;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.symbolic.ExprPrinter;
import org.tensorlatex.symbolic.Rational;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests objects that are derived on first reference: metric inverse and determinant,
 * Christoffel symbols, covariant derivatives and partial-derivative tensors.
 */
public class DerivedObjectSynthesizerTest {

    private static final String POLAR = "% define basis [r, \\theta]; % define metric gDD (2); "
            + "g_{0 0} = 1; g_{0 1} = 0; g_{1 1} = r^{{2}}";

    private Translator translator;
    private TranslationSession session;

    @BeforeEach
    void setUp() {
        translator = new Translator();
        session = new TranslationSession(SessionConfig.defaults());
    }

    @Test
    @Tag("unit")
    void testChristoffelSymbolsOfPolarMetric() throws TranslationException {
        // Arrange
        translator.parse(POLAR, session).orElseThrow();

        // Act
        ParseResult radial = translator.parseExpression("\\Gamma^{0}_{1 1}", session);
        ParseResult angular = translator.parseExpression("\\Gamma^{1}_{0 1}", session);

        // Assert
        assertThat(radial.hasErrors()).isFalse();
        assertThat(ExprPrinter.print(radial.expression())).isEqualTo("-r");
        assertThat(ExprPrinter.print(angular.expression())).isEqualTo("1/r");
    }

    /**
     * The divergence of the radial field r e_r in polar coordinates picks up the connection
     * term Gamma^1_{10} v^0 = 1 on top of the partial derivative.
     */
    @Test
    @Tag("unit")
    void testDivergenceUsesCovariantDerivative() throws TranslationException {
        // Arrange
        translator.parse(POLAR + "; % define nosym vU (2); v^{0} = r; v^{1} = 0", session).orElseThrow();

        // Act
        ParseResult result = translator.parse("d = \\nabla_a v^a", session).orElseThrow();

        // Assert
        assertThat(result.binding("d")).contains(Rational.TWO);
    }

    @Test
    @Tag("unit")
    void testUpdateMetricComputesInverseAndDeterminant() throws TranslationException {
        // Arrange
        translator.parse("% define sym01 hDD (2); h_{0 0} = 1; h_{0 1} = 0; h_{1 1} = 4; % update metric hDD",
                session).orElseThrow();

        // Act
        ParseResult inverse = translator.parseExpression("h^{1 1}", session);
        ParseResult determinant = translator.parseExpression("\\mathop{hdet}", session);

        // Assert
        assertThat(inverse.expression()).isEqualTo(Rational.of(1, 4));
        assertThat(determinant.expression()).isEqualTo(Rational.of(4));
    }

    /**
     * Verifies that reassigning a metric component drops the cached inverse.
     */
    @Test
    @Tag("unit")
    void testInverseIsRecomputedAfterMetricChanges() throws TranslationException {
        // Arrange
        translator.parse("% define metric gDD (2); g_{0 0} = 1; g_{0 1} = 0; g_{1 1} = 4; x = g^{1 1}", session)
                .orElseThrow();

        // Act
        ParseResult result = translator.parse("g_{1 1} = 9; y = g^{1 1}", session).orElseThrow();

        // Assert
        assertThat(result.binding("y")).contains(Rational.of(1, 9));
        assertThat(session.namespace().value("gUU11")).contains(Rational.of(1, 9));
    }

    @Test
    @Tag("unit")
    void testSingularMetric() {
        // Act
        ParseResult result = translator.parse(
                "% define metric gDD (2); g_{0 0} = 1; g_{0 1} = 1; g_{1 1} = 1; x = g^{0 0}", session);

        // Assert
        assertThat(result.errors()).extracting(Diagnostic::kind, Diagnostic::message)
                .containsExactly(tuple(Diagnostic.Kind.TENSOR_ERROR, "singular metric 'gDD'"));
        assertThat(session.namespace().isDeclared("gUU")).isFalse();
    }

    @Test
    @Tag("unit")
    void testChristoffelWithoutMetric() {
        // Act
        ParseResult result = translator.parseExpression("\\Gamma^{0}_{1 1}", session);

        // Assert
        assertThat(result.errors()).extracting(Diagnostic::message).containsExactly("undefined metric");
        assertThat(session.namespace().isDeclared("GammaUDD")).isFalse();
    }

    /**
     * A failure inside a generated equation is reported at the user's structure and names the
     * generated equation.
     */
    @Test
    @Tag("unit")
    void testErrorInGeneratedEquationPointsAtUserSentence() throws TranslationException {
        // Arrange
        translator.parse("% define metric gDD (2); g_{0 0} = 1; g_{0 1} = 0; g_{1 1} = 1", session).orElseThrow();

        // Act
        ParseResult result = translator.parse("x = 1; y = \\Gamma^{0}_{0 0}", session);

        // Assert
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.kind()).isEqualTo(Diagnostic.Kind.TENSOR_ERROR);
            assertThat(error.message()).startsWith(
                    "cannot differentiate symbolically without basis in generated equation '\\Gamma^{");
            assertThat(error.sentence()).isEqualTo("x = 1; y = \\Gamma^{0}_{0 0}");
            assertThat(error.position()).isEqualTo(7);
        });
        assertThat(session.namespace().isDeclared("GammaUDD")).isFalse();
    }

    /**
     * Partial derivatives in {@code _d} mode become tensors with one symbol per component.
     */
    @Test
    @Tag("unit")
    void testPartialDerivativeTensor() throws TranslationException {
        // Arrange
        translator.parse("% define nosym vU (2)", session).orElseThrow();

        // Act
        ParseResult first = translator.parse("w^{a}_{b} = \\vphantom{_d} \\partial_{b} v^{a}", session)
                .orElseThrow();
        ParseResult second = translator.parse("u^{a}_{b c} = \\vphantom{_d} \\partial_{b} \\partial_{c} v^{a}",
                session).orElseThrow();

        // Assert
        assertThat(first.bindings()).containsKeys("vU_dD00", "vU_dD11");
        assertThat(ExprPrinter.print(first.bindings().get("wUD01"))).isEqualTo("vU_dD01");
        assertThat(ExprPrinter.print(second.bindings().get("uUDD010"))).isEqualTo("vU_dDD001");
    }
}
