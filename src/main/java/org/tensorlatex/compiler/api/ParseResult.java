package org.tensorlatex.compiler.api;

import org.tensorlatex.compiler.diagnostics.Diagnostic;
import org.tensorlatex.symbolic.Expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The outcome of a translation call.
 *
 * @param bindings    Every name bound during the call, in the order it was first bound.
 * @param diagnostics Errors and warnings, in the order they were raised.
 * @param expression  The evaluated expression of {@link ITranslator#parseExpression}, otherwise {@code null}.
 */
public record ParseResult(Map<String, Expr> bindings, List<Diagnostic> diagnostics, Expr expression) {

    public ParseResult {
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).toList();
    }

    public Optional<Expr> binding(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * Returns this result if it carries no error.
     * @return This result.
     * @throws TranslationException carrying all diagnostics if an error was reported.
     */
    public ParseResult orElseThrow() throws TranslationException {
        if (hasErrors()) {
            String summary = diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
            throw new TranslationException(summary, diagnostics);
        }
        return this;
    }
}
