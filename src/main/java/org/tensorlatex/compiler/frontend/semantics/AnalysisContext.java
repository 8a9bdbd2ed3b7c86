package org.tensorlatex.compiler.frontend.semantics;

import org.tensorlatex.compiler.diagnostics.DiagnosticsEngine;
import org.tensorlatex.compiler.diagnostics.LatexException;
import org.tensorlatex.compiler.diagnostics.TensorException;
import org.tensorlatex.symbolic.Expr;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * State of one translation call as seen by the semantic handlers: the session, the diagnostics,
 * the ordered result bindings and the sentence being analyzed. Sentences generated during
 * synthesis run in a {@link #child(String) child} context that shares everything but the sentence.
 */
public class AnalysisContext {

    private final TranslationSession session;
    private final DiagnosticsEngine diagnostics;
    private final Map<String, Expr> bindings;
    private final SentenceExecutor executor;
    private final Set<String> inProgress;
    private final String sentence;

    /**
     * Creates the context of a top-level translation call.
     * @param session     The session.
     * @param diagnostics Collects warnings.
     * @param bindings    Receives every name bound during the call, in order.
     * @param executor    Runs generated sentences.
     * @param sentence    The sentence being translated.
     */
    public AnalysisContext(TranslationSession session, DiagnosticsEngine diagnostics, Map<String, Expr> bindings,
                           SentenceExecutor executor, String sentence) {
        this(session, diagnostics, bindings, executor, new HashSet<>(), sentence);
    }

    private AnalysisContext(TranslationSession session, DiagnosticsEngine diagnostics, Map<String, Expr> bindings,
                            SentenceExecutor executor, Set<String> inProgress, String sentence) {
        this.session = session;
        this.diagnostics = diagnostics;
        this.bindings = bindings;
        this.executor = executor;
        this.inProgress = inProgress;
        this.sentence = sentence;
    }

    public TranslationSession session() {
        return session;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public String sentence() {
        return sentence;
    }

    public AnalysisContext child(String generated) {
        return new AnalysisContext(session, diagnostics, bindings, executor, inProgress, generated);
    }

    /**
     * Writes a value into the namespace and records it as a result of this call.
     * @param name  The component or scalar name.
     * @param value The value.
     */
    public void bind(String name, Expr value) {
        session.namespace().put(name, value);
        bindings.put(name, value);
    }

    /**
     * Runs a generated sentence against the same session, recording its bindings here.
     * @param generated The LaTeX sentence.
     * @throws TensorException without position if the generated sentence fails; it names the
     *                         sentence in its message.
     */
    public void execute(String generated) {
        try {
            executor.execute(generated, child(generated));
        } catch (LatexException e) {
            throw TensorException.inGeneratedEquation(e, generated);
        }
    }

    /**
     * Marks a name as being derived, so that a derivation that needs itself fails instead of
     * recursing forever.
     * @param name The derived tensor's name.
     * @throws TensorException {@code circular derivation of 'name'} if it is already in progress.
     */
    public void beginDerivation(String name) {
        if (!inProgress.add(name)) {
            throw new TensorException(String.format("circular derivation of '%s'", name));
        }
    }

    public void endDerivation(String name) {
        inProgress.remove(name);
    }
}
