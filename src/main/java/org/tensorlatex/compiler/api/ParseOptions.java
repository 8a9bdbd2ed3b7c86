package org.tensorlatex.compiler.api;

import org.tensorlatex.compiler.config.SessionConfig;

/**
 * Options of a single {@link ITranslator#parse} call.
 *
 * @param continueOnError Whether a failing structure is reported and skipped instead of ending the call.
 */
public record ParseOptions(boolean continueOnError) {

    public static ParseOptions strict() {
        return new ParseOptions(false);
    }

    public static ParseOptions continuing() {
        return new ParseOptions(true);
    }

    public static ParseOptions from(SessionConfig config) {
        return new ParseOptions(config.continueOnError());
    }
}
