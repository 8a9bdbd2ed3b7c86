package org.tensorlatex.compiler.frontend.parser.features.command;

import org.tensorlatex.compiler.frontend.lexer.TokenType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for command handlers, keyed by the token type the lexer assigns to the command.
 * {@link TokenType#COMMAND}, the catch-all for unknown commands, has no handler.
 */
public class CommandHandlerRegistry {
    private final Map<TokenType, ICommandHandler> handlers = new EnumMap<>(TokenType.class);

    public void register(TokenType type, ICommandHandler handler) {
        handlers.put(type, handler);
    }

    public Optional<ICommandHandler> get(TokenType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new registry.
     */
    public static CommandHandlerRegistry initialize() {
        CommandHandlerRegistry registry = new CommandHandlerRegistry();
        registry.register(TokenType.SQRT_CMD, new SqrtCommandHandler());
        registry.register(TokenType.FRAC_CMD, new FracCommandHandler());
        registry.register(TokenType.NLOG_CMD, new LogarithmCommandHandler());
        registry.register(TokenType.TRIG_CMD, new TrigCommandHandler());
        return registry;
    }
}
