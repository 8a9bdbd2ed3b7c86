package org.tensorlatex.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tensorlatex.symbolic.DerivativeMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link SessionConfig}.
 */
public class SessionConfigTest {

    @Test
    @Tag("unit")
    void defaultsComeFromReferenceConf() {
        SessionConfig config = SessionConfig.defaults();

        assertThat(config).isEqualTo(new SessionConfig(false, false, DerivativeMode.SYMBOLIC, 0));
    }

    /**
     * Verifies that given keys override the bundled defaults while missing keys fall back to them.
     */
    @Test
    @Tag("unit")
    void partialBlockFallsBackToReference() {
        // Arrange
        Config raw = ConfigFactory.parseString("""
                tensorlatex.session {
                  continue-on-error = true
                  derivative-mode = "_d"
                }
                """);

        // Act
        SessionConfig config = SessionConfig.fromConfig(raw);

        // Assert
        assertThat(config.continueOnError()).isTrue();
        assertThat(config.silentRedefinition()).isFalse();
        assertThat(config.derivativeMode()).isEqualTo(DerivativeMode.TENSOR);
        assertThat(config.defaultDimension()).isZero();
    }

    @Test
    @Tag("unit")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> SessionConfig.fromConfig(ConfigFactory.parseString("tensorlatex.session.derivative-mode = numeric")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numeric");
        assertThatThrownBy(() -> SessionConfig.fromConfig(ConfigFactory.parseString("tensorlatex.session.default-dimension = -1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SessionConfig.fromConfig(ConfigFactory.parseString("tensorlatex.session.continue-on-error = maybe")))
                .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    @Tag("unit")
    void withContinueOnErrorKeepsOtherSettings() {
        SessionConfig config = new SessionConfig(false, true, DerivativeMode.TENSOR, 4).withContinueOnError(true);

        assertThat(config).isEqualTo(new SessionConfig(true, true, DerivativeMode.TENSOR, 4));
    }
}
