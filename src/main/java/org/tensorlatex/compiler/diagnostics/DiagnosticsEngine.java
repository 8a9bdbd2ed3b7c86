package org.tensorlatex.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while translating a sentence.
 * <p>
 * This decouples error reporting from the parser and the index engine: both raise
 * {@link LatexException}s, and the translator records them here at structure boundaries.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records a raised translation error.
     *
     * @param exception The error.
     * @return The recorded diagnostic.
     */
    public Diagnostic report(LatexException exception) {
        Diagnostic diagnostic = new Diagnostic(exception.kind(), exception.getMessage(),
                exception.sentence(), exception.position());
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    /**
     * Reports a warning.
     *
     * @param kind     The warning kind.
     * @param message  The warning message.
     * @param sentence The sentence being translated.
     * @param position The offending position, or -1.
     */
    public void reportWarning(Diagnostic.Kind kind, String message, String sentence, int position) {
        diagnostics.add(new Diagnostic(kind, message, sentence, position));
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
