package org.tensorlatex.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.tensorlatex.symbolic.DerivativeMode;

/**
 * Session defaults read from the {@code tensorlatex.session} block.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * tensorlatex.session {
 *   continue-on-error = false     # skip failing structures instead of stopping
 *   silent-redefinition = false   # suppress the redefinition warning
 *   derivative-mode = "symbolic"  # or "_d"
 *   default-dimension = 0         # 0 means none until the first declaration
 * }
 * </pre>
 *
 * @param continueOnError    Whether a failing structure is skipped.
 * @param silentRedefinition Whether redefinitions go without warning.
 * @param derivativeMode     The initial derivative mode.
 * @param defaultDimension   The initial default dimension, 0 for none.
 */
public record SessionConfig(boolean continueOnError, boolean silentRedefinition,
                            DerivativeMode derivativeMode, int defaultDimension) {

    private static final String SESSION_CONFIG_PATH = "tensorlatex.session";

    public static SessionConfig defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Reads the session block, falling back to the bundled {@code reference.conf} for missing keys.
     * @param config The application configuration.
     * @return The session settings.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     * @throws IllegalArgumentException if the derivative mode is unknown.
     */
    public static SessionConfig fromConfig(Config config) {
        Config session = config.withFallback(ConfigFactory.defaultReference()).getConfig(SESSION_CONFIG_PATH);
        int dimension = session.getInt("default-dimension");
        if (dimension < 0) {
            throw new IllegalArgumentException("default-dimension must not be negative: " + dimension);
        }
        return new SessionConfig(
                session.getBoolean("continue-on-error"),
                session.getBoolean("silent-redefinition"),
                DerivativeMode.fromKeyword(session.getString("derivative-mode")),
                dimension);
    }

    public SessionConfig withContinueOnError(boolean continueOnError) {
        return new SessionConfig(continueOnError, silentRedefinition, derivativeMode, defaultDimension);
    }
}
