package org.yangtree.compiler.frontend.builder;

import org.yangtree.compiler.model.Keyword;

/**
 * One deferred attribute event in a node's blueprint.
 * <p>
 * An attribute statement with substatements is recorded as an {@code enter}, the nested
 * instructions, then the matching {@code leave}, so replay sees the same nesting the
 * source had.
 *
 * @param enter    {@code true} for an enter event, {@code false} for a leave event.
 * @param keyword  the statement keyword.
 * @param argument the converted argument ({@code String}, {@link org.yangtree.compiler.model.Identifier}
 *                 or {@link org.yangtree.compiler.model.SchemaPath}); {@code null} for leave events
 *                 and argument-less statements.
 * @param line     the source line of the statement.
 */
public record Instruction(boolean enter, Keyword keyword, Object argument, int line) {

    public static Instruction enter(Keyword keyword, Object argument, int line) {
        return new Instruction(true, keyword, argument, line);
    }

    public static Instruction leave(Keyword keyword, int line) {
        return new Instruction(false, keyword, null, line);
    }

    /**
     * The argument as text, for handlers that take string arguments.
     */
    public String text() {
        return argument == null ? null : argument.toString();
    }

    @Override
    public String toString() {
        return enter ? "enter(" + keyword.text() + " " + argument + ")" : "leave(" + keyword.text() + ")";
    }
}
