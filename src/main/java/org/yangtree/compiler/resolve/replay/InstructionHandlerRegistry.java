package org.yangtree.compiler.resolve.replay;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.yangtree.compiler.model.Keyword;
import org.yangtree.compiler.resolve.replay.handlers.BaseHandler;
import org.yangtree.compiler.resolve.replay.handlers.EnumMemberHandler;
import org.yangtree.compiler.resolve.replay.handlers.FlagAttributeHandler;
import org.yangtree.compiler.resolve.replay.handlers.TypeHandler;
import org.yangtree.compiler.resolve.replay.handlers.TypeRestrictionHandler;
import org.yangtree.compiler.resolve.replay.handlers.ValueAttributeHandler;

/**
 * Maps attribute keywords to the handlers that interpret them during replay.
 */
public final class InstructionHandlerRegistry {

    private final Map<Keyword, IInstructionHandler> handlers = new EnumMap<>(Keyword.class);

    /**
     * Registers the handler for an attribute keyword, replacing any previous one.
     *
     * @param keyword the attribute keyword.
     * @param handler the handler instance.
     */
    public void register(Keyword keyword, IInstructionHandler handler) {
        if (keyword.role() != Keyword.Role.ATTRIBUTE) {
            throw new IllegalArgumentException("Only attribute keywords are replayed: " + keyword);
        }
        handlers.put(keyword, handler);
    }

    public Optional<IInstructionHandler> resolve(Keyword keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Creates a registry covering every attribute keyword.
     *
     * @return a fully initialized registry.
     * @throws IllegalStateException if an attribute keyword has no handler.
     */
    public static InstructionHandlerRegistry initializeWithDefaults() {
        InstructionHandlerRegistry registry = new InstructionHandlerRegistry();

        registry.register(Keyword.TYPE, new TypeHandler());

        TypeRestrictionHandler restrictions = new TypeRestrictionHandler();
        registry.register(Keyword.RANGE, restrictions);
        registry.register(Keyword.LENGTH, restrictions);
        registry.register(Keyword.FRACTION_DIGITS, restrictions);
        registry.register(Keyword.PATH, restrictions);
        registry.register(Keyword.REQUIRE_INSTANCE, restrictions);

        EnumMemberHandler members = new EnumMemberHandler();
        registry.register(Keyword.ENUM, members);
        registry.register(Keyword.VALUE, members);
        registry.register(Keyword.BIT, members);
        registry.register(Keyword.POSITION, members);

        registry.register(Keyword.BASE, new BaseHandler());

        FlagAttributeHandler flags = new FlagAttributeHandler();
        registry.register(Keyword.CONFIG, flags);
        registry.register(Keyword.MANDATORY, flags);
        registry.register(Keyword.PRESENCE, flags);
        registry.register(Keyword.ORDERED_BY, flags);
        registry.register(Keyword.STATUS, flags);

        ValueAttributeHandler values = new ValueAttributeHandler();
        registry.register(Keyword.DEFAULT, values);
        registry.register(Keyword.KEY, values);
        registry.register(Keyword.UNITS, values);
        registry.register(Keyword.NAMESPACE, values);

        for (Keyword keyword : Keyword.values()) {
            if (keyword.role() == Keyword.Role.ATTRIBUTE && !registry.handlers.containsKey(keyword)) {
                throw new IllegalStateException("No replay handler for attribute keyword '" + keyword.text() + "'");
            }
        }
        return registry;
    }
}
