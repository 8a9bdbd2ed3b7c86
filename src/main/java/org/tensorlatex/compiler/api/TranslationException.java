package org.tensorlatex.compiler.api;

import org.tensorlatex.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when a translation reported one or more errors.
 * <p>
 * It is part of the public API and hides the internal exception types of the translator.
 */
public class TranslationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new translation exception.
     * @param message     The formatted diagnostics.
     * @param diagnostics The diagnostics of the failed call.
     */
    public TranslationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
