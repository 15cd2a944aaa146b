package org.yangtree.compiler.frontend.parser;

/**
 * Receives the statement structure of a module as a stream of enter/leave events.
 */
public interface IStatementListener {

    /**
     * Called when a statement starts.
     *
     * @param keyword  the keyword as written, possibly prefixed for extension statements.
     * @param argument the argument with concatenations folded, or {@code null} if absent.
     * @param line     the line the keyword is on.
     */
    void enterStatement(String keyword, String argument, int line);

    /**
     * Called when a statement ends, after all its substatements.
     *
     * @param keyword the keyword passed to the matching {@link #enterStatement}.
     */
    void leaveStatement(String keyword);
}
