package org.tensorlatex.compiler.frontend.directive;

import org.tensorlatex.compiler.frontend.parser.features.define.DefineDirectiveHandler;
import org.tensorlatex.compiler.frontend.parser.features.parse.ParseDirectiveHandler;
import org.tensorlatex.compiler.frontend.parser.features.update.UpdateDirectiveHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for directive handlers. This class holds a map of macro names
 * to their corresponding handlers.
 */
public class DirectiveHandlerRegistry {
    private final Map<String, IDirectiveHandler> handlers = new HashMap<>();

    /**
     * Registers a new directive handler.
     * @param macroName The name of the macro (e.g., "define").
     * @param handler The handler for the macro.
     */
    public void register(String macroName, IDirectiveHandler handler) {
        handlers.put(macroName.toLowerCase(), handler);
    }

    /**
     * Gets the handler for a given macro name.
     * @param macroName The name of the macro.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IDirectiveHandler> get(String macroName) {
        return Optional.ofNullable(handlers.get(macroName.toLowerCase()));
    }

    /**
     * Initializes the directive handler registry with all the built-in handlers.
     * @return A new instance of {@link DirectiveHandlerRegistry} with all handlers registered.
     */
    public static DirectiveHandlerRegistry initialize() {
        DirectiveHandlerRegistry registry = new DirectiveHandlerRegistry();
        registry.register("define", new DefineDirectiveHandler());
        UpdateDirectiveHandler update = new UpdateDirectiveHandler();
        registry.register("update", update);
        registry.register("assign", update);
        registry.register("parse", new ParseDirectiveHandler());
        return registry;
    }
}
