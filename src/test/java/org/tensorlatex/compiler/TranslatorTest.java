package org.tensorlatex.compiler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.tensorlatex.compiler.api.ParseOptions;
import org.tensorlatex.compiler.api.ParseResult;
import org.tensorlatex.compiler.api.TranslationException;
import org.tensorlatex.compiler.config.SessionConfig;
import org.tensorlatex.compiler.diagnostics.Diagnostic;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.junit.extensions.logging.ExpectLog;
import org.tensorlatex.junit.extensions.logging.LogLevel;
import org.tensorlatex.junit.extensions.logging.LogWatchExtension;
import org.tensorlatex.symbolic.DerivativeMode;
import org.tensorlatex.symbolic.ExprPrinter;
import org.tensorlatex.symbolic.Power;
import org.tensorlatex.symbolic.Rational;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * End-to-end tests of the {@link Translator}: sentences go through lexing, parsing and
 * semantic analysis against a {@link TranslationSession}.
 */
@ExtendWith(LogWatchExtension.class)
public class TranslatorTest {

    private Translator translator;
    private TranslationSession session;

    @BeforeEach
    void setUp() {
        translator = new Translator();
        session = new TranslationSession(SessionConfig.defaults());
    }

    /**
     * Verifies that symbols without declaration evaluate to plain symbols.
     */
    @Test
    @Tag("unit")
    void testExpressionOfPlainSymbols() {
        // Act
        ParseResult result = translator.parseExpression("(1 + x/n)^n", session);

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(ExprPrinter.print(result.expression())).isEqualTo("(1 + x/n)**n");
    }

    @Test
    @Tag("unit")
    void testScalarAssignmentsSeeEarlierResults() throws TranslationException {
        // Act
        ParseResult result = translator.parse("a = 2; b = a^{2} + 1/2", session).orElseThrow();

        // Assert
        assertThat(result.binding("a")).contains(Rational.TWO);
        assertThat(result.binding("b")).contains(Rational.of(9, 2));
    }

    /**
     * Later calls on the same session see the values of earlier calls; a reset forgets them.
     */
    @Test
    @Tag("unit")
    void testSessionCarriesStateAcrossCalls() {
        // Arrange
        translator.parse("% define nosym vD (2); v_{0} = 3", session);

        // Act
        ParseResult sum = translator.parseExpression("v_{0} + v_{1}", session);
        session.reset();
        ParseResult afterReset = translator.parseExpression("v_{0}", session);

        // Assert
        assertThat(ExprPrinter.print(sum.expression())).isEqualTo("3 + vD1");
        assertThat(afterReset.errors()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("undefined tensor 'vD'");
    }

    @Test
    @Tag("unit")
    void testStrictModeStopsAtFirstError() {
        // Act
        ParseResult result = translator.parse("a = 1; b = ); c = 3", session, ParseOptions.strict());

        // Assert
        assertThat(result.bindings()).containsOnlyKeys("a");
        assertThat(result.errors()).singleElement()
                .extracting(Diagnostic::kind, Diagnostic::position)
                .containsExactly(Diagnostic.Kind.PARSE_ERROR, 11);
        assertThatThrownBy(result::orElseThrow)
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("ParseError")
                .satisfies(e -> assertThat(((TranslationException) e).getDiagnostics()).hasSize(1));
    }

    /**
     * Verifies that in continue-on-error mode every failing structure is reported and logged,
     * while the remaining structures are still translated.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Skipping structure: .*", occurrences = 2)
    void testContinueOnErrorReportsEveryFailure() {
        // Act
        ParseResult result = translator.parse("a = ); b = 1; c = \\unknown; d = b + 1", session,
                ParseOptions.continuing());

        // Assert
        assertThat(result.errors()).extracting(Diagnostic::kind, Diagnostic::position).containsExactly(
                tuple(Diagnostic.Kind.PARSE_ERROR, 4),
                tuple(Diagnostic.Kind.PARSE_ERROR, 18));
        assertThat(result.bindings()).containsOnlyKeys("b", "d");
        assertThat(result.binding("d")).contains(Rational.TWO);
    }

    /**
     * Continue-on-error can also be switched on through the session configuration.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Skipping structure: undefined tensor 'TUU'")
    void testContinueOnErrorFromConfiguration() {
        // Arrange
        TranslationSession continuing = new TranslationSession(SessionConfig.defaults().withContinueOnError(true));

        // Act
        ParseResult result = translator.parse("% define nosym vD (2); s = T^{a b} v_a; t = 5", continuing);

        // Assert
        assertThat(result.errors()).singleElement()
                .extracting(Diagnostic::kind, Diagnostic::message, Diagnostic::position)
                .containsExactly(Diagnostic.Kind.TENSOR_ERROR, "undefined tensor 'TUU'", 23);
        assertThat(result.binding("t")).contains(Rational.of(5));
    }

    /**
     * Inside an environment a failing line is skipped and the next line is translated.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Skipping structure: .*")
    void testContinueOnErrorInsideEnvironment() {
        // Act
        ParseResult result = translator.parse("\\begin{align} a &= ) \\\\ b &= 4 \\end{align}", session,
                ParseOptions.continuing());

        // Assert
        assertThat(result.errors()).hasSize(1);
        assertThat(result.binding("b")).contains(Rational.of(4));
    }

    @Test
    @Tag("unit")
    void testLexErrorIsReportedWithPosition() {
        ParseResult result = translator.parse("a = 1 # 2", session);

        assertThat(result.errors()).singleElement()
                .extracting(Diagnostic::kind, Diagnostic::message, Diagnostic::position)
                .containsExactly(Diagnostic.Kind.LEX_ERROR, "unexpected character '#' at position 6", 6);
        assertThat(result.errors().get(0).indicator()).isEqualTo("a = 1 # 2\n      ^");
    }

    /**
     * Verifies that redefining a name warns, logs and replaces the old declaration.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "redefinition of 'vU' in .*")
    void testRedefinitionWarns() {
        // Act
        ParseResult result = translator.parse("% define nosym vU (2); v^{0} = 1; % define nosym vU (2)", session);

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.warnings()).singleElement()
                .extracting(Diagnostic::kind, Diagnostic::message)
                .containsExactly(Diagnostic.Kind.OVERRIDE_WARNING, "redefinition of 'vU'");
        assertThat(ExprPrinter.print(result.bindings().get("vU0"))).isEqualTo("vU0");
    }

    @Test
    @Tag("unit")
    void testSilentRedefinition() {
        TranslationSession silent = new TranslationSession(new SessionConfig(false, true, DerivativeMode.SYMBOLIC, 0));

        ParseResult result = translator.parse("% define nosym vU (2); % define nosym vU (2)", silent);

        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testInconsistentRedefinitionIsAnError() {
        ParseResult result = translator.parse("% define nosym vU (3); % define nosym vU (2)", session);

        assertThat(result.errors()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("inconsistent tensor dimension of 'vU': 2, was 3");
    }

    @Test
    @Tag("unit")
    void testMissingDimension() {
        ParseResult result = translator.parse("% define nosym vU", session);

        assertThat(result.errors()).singleElement()
                .extracting(Diagnostic::message, Diagnostic::position)
                .containsExactly("missing dimension of 'vU'", 9);
    }

    /**
     * A dimension given once becomes the default for later declarations.
     */
    @Test
    @Tag("unit")
    void testDefaultDimensionFromEarlierDeclaration() {
        ParseResult result = translator.parse("% define nosym vU (3), nosym wD", session);

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.bindings()).containsKeys("wD0", "wD1", "wD2").doesNotContainKey("wD3");
    }

    @Test
    @Tag("unit")
    void testEulerNumberNextToLetters() {
        // Act
        ParseResult result = translator.parseExpression("ex - xe", session);
        ParseResult determinant = translator.parse("% define const gdet; y = \\mathop{gdet}", session);

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.expression()).isEqualTo(Rational.ZERO);
        assertThat(determinant.hasErrors()).isFalse();
        assertThat(ExprPrinter.print(determinant.bindings().get("y"))).isEqualTo("gdet");
    }

    /**
     * Exponents too large for an exact result stay symbolic, and counts that do not fit an int
     * are reported as parse errors rather than escaping as runtime exceptions.
     */
    @Test
    @Tag("unit")
    void testOversizedNumbers() {
        // Act
        ParseResult power = translator.parseExpression("2^{99999999999}", session);
        ParseResult root = translator.parseExpression("2^{1/99999999999}", session);
        ParseResult sqrt = translator.parseExpression("\\sqrt[99999999999]{2}", session);
        ParseResult dimension = translator.parse("% define nosym vU (99999999999)", session);

        // Assert
        assertThat(power.hasErrors()).isFalse();
        assertThat(power.expression()).isInstanceOf(Power.class);
        assertThat(root.hasErrors()).isFalse();
        assertThat(root.expression()).isInstanceOf(Power.class);
        assertThat(sqrt.errors()).singleElement()
                .extracting(Diagnostic::kind, Diagnostic::message, Diagnostic::position)
                .containsExactly(Diagnostic.Kind.PARSE_ERROR, "integer '99999999999' out of range at position 6", 6);
        assertThat(dimension.errors()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("integer '99999999999' out of range at position 19");
    }

    @Test
    @Tag("unit")
    void testConstantsAndUnsupportedMacro() {
        ParseResult constant = translator.parse("% define const k; y = 2 k", session);
        ParseResult macro = translator.parse("% \\include foo", session);

        assertThat(ExprPrinter.print(constant.bindings().get("y"))).isEqualTo("2*k");
        assertThat(macro.errors()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("unsupported macro '\\include' at position 2");
    }

    /**
     * Verifies that {@code update} re-runs the equation that defined a tensor, picking up new
     * values of its inputs.
     */
    @Test
    @Tag("unit")
    void testUpdateRerunsDefiningEquation() {
        // Act
        ParseResult result = translator.parse(
                "% define nosym vU (2); w^a = 2 v^a; v^{0} = 5; % update wU", session);

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.binding("wU0")).contains(Rational.of(10));
        assertThat(ExprPrinter.print(result.bindings().get("wU1"))).isEqualTo("2*vU1");
    }

    @Test
    @Tag("unit")
    void testUpdateOfUndefinedTensor() {
        ParseResult result = translator.parse("% update xU", session);

        assertThat(result.errors()).singleElement()
                .extracting(Diagnostic::kind, Diagnostic::message)
                .containsExactly(Diagnostic.Kind.TENSOR_ERROR, "cannot update undefined tensor 'xU'");
    }
}
