package org.yangtree.compiler.frontend.lexer;

/**
 * Token categories produced by the {@link Lexer}.
 */
public enum TokenType {
    /** A single- or double-quoted string; the text is the unquoted (and unescaped) content. */
    QUOTED_STRING,
    /** A keyword or an unquoted argument. */
    UNQUOTED_STRING,
    /** {@code ;} */
    STATEMENT_END,
    /** <code>{</code> */
    BLOCK_BEGIN,
    /** <code>}</code> */
    BLOCK_END,
    /** {@code +} joining two quoted argument strings. */
    CONCAT
}
