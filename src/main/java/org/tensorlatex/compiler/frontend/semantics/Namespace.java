package org.tensorlatex.compiler.frontend.semantics;

import org.tensorlatex.symbolic.Expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Declarations and component values of a session. Values are keyed by fully expanded
 * component names such as {@code hUD01}, {@code gdet} or {@code h}.
 */
public class Namespace {

    private final Map<String, TensorDeclaration> declarations = new LinkedHashMap<>();
    private final Map<String, Expr> values = new LinkedHashMap<>();

    public Optional<TensorDeclaration> declaration(String name) {
        return Optional.ofNullable(declarations.get(name));
    }

    public boolean isDeclared(String name) {
        return declarations.containsKey(name);
    }

    public void declare(TensorDeclaration declaration) {
        declarations.put(declaration.name(), declaration);
    }

    /**
     * Drops a declaration together with all of its component values.
     * @param name The tensor or scalar name.
     */
    public void remove(String name) {
        TensorDeclaration declaration = declarations.remove(name);
        if (declaration != null) {
            for (int[] component : declaration.components()) {
                values.remove(declaration.componentName(component));
            }
        }
        values.remove(name);
    }

    public Optional<Expr> value(String componentName) {
        return Optional.ofNullable(values.get(componentName));
    }

    public boolean hasValue(String componentName) {
        return values.containsKey(componentName);
    }

    public void put(String componentName, Expr value) {
        values.put(componentName, value);
    }

    public Map<String, Expr> values() {
        return Collections.unmodifiableMap(values);
    }

    public Map<String, TensorDeclaration> declarations() {
        return Collections.unmodifiableMap(declarations);
    }

    public void clear() {
        declarations.clear();
        values.clear();
    }
}
