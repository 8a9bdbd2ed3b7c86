package org.tensorlatex.compiler.frontend.semantics;

/**
 * Parses and analyzes a sentence within an existing analysis. Implemented by the translator,
 * used to run equations generated for derived objects through the regular pipeline.
 */
@FunctionalInterface
public interface SentenceExecutor {

    /**
     * @param sentence The sentence.
     * @param context  The context the sentence's structures are analyzed in.
     */
    void execute(String sentence, AnalysisContext context);
}
