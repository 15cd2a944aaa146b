package org.yangtree.compiler.frontend.lexer;

/**
 * A lexical token of YANG source text.
 *
 * @param type   the token category.
 * @param text   the token text; for quoted strings the content without quotes.
 * @param line   the 1-based line the token starts on.
 * @param column the 1-based column the token starts at.
 */
public record Token(TokenType type, String text, int line, int column) {

    public boolean isString() {
        return type == TokenType.QUOTED_STRING || type == TokenType.UNQUOTED_STRING;
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
