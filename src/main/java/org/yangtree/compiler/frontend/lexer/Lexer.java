package org.yangtree.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

import org.yangtree.compiler.api.ModelProcessingException;

/**
 * Converts YANG source text into a flat list of {@link Token}s.
 * <p>
 * The lexer is a character-level state machine. Besides the character position it tracks
 * where in a statement it is, because a {@code +} means concatenation only directly after an
 * argument string; as a keyword or inside an unquoted argument it is an ordinary character.
 * Whitespace and both comment forms are discarded.
 * <p>
 * Unterminated quoted strings and unterminated block comments are fatal. Block balance is
 * left to the {@link org.yangtree.compiler.frontend.parser.StatementParser}.
 */
public final class Lexer {

    private enum Position {
        STATEMENT_START,
        AFTER_KEYWORD,
        AFTER_ARGUMENT,
        AFTER_CONCAT
    }

    private final String source;
    private final String sourceName;
    private final List<Token> tokens = new ArrayList<>();

    private Position position = Position.STATEMENT_START;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * @param source     the module text.
     * @param sourceName the module or file name used in error messages.
     */
    public Lexer(String source, String sourceName) {
        this.source = source;
        this.sourceName = sourceName;
    }

    /**
     * Scans the entire source.
     *
     * @return the tokens in source order.
     * @throws ModelProcessingException on unterminated strings or comments.
     */
    public List<Token> scanTokens() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        int startLine = line;
        int startColumn = column;
        char c = peek();
        switch (c) {
            case ';' -> {
                advance();
                addToken(TokenType.STATEMENT_END, ";", startLine, startColumn);
                position = Position.STATEMENT_START;
            }
            case '{' -> {
                advance();
                addToken(TokenType.BLOCK_BEGIN, "{", startLine, startColumn);
                position = Position.STATEMENT_START;
            }
            case '}' -> {
                advance();
                addToken(TokenType.BLOCK_END, "}", startLine, startColumn);
                position = Position.STATEMENT_START;
            }
            case '"' -> {
                advance();
                addToken(TokenType.QUOTED_STRING, doubleQuoted(startLine), startLine, startColumn);
                afterString();
            }
            case '\'' -> {
                advance();
                addToken(TokenType.QUOTED_STRING, singleQuoted(startLine), startLine, startColumn);
                afterString();
            }
            default -> {
                if (c == '+' && position == Position.AFTER_ARGUMENT && isConcatOperator()) {
                    advance();
                    addToken(TokenType.CONCAT, "+", startLine, startColumn);
                    position = Position.AFTER_CONCAT;
                } else {
                    addToken(TokenType.UNQUOTED_STRING, unquoted(), startLine, startColumn);
                    afterString();
                }
            }
        }
    }

    private void afterString() {
        position = position == Position.STATEMENT_START ? Position.AFTER_KEYWORD : Position.AFTER_ARGUMENT;
    }

    private boolean isConcatOperator() {
        char next = peekNext();
        return next == '\0' || Character.isWhitespace(next) || next == '"' || next == '\'';
    }

    private String doubleQuoted(int startLine) {
        StringBuilder text = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> text.append('\n');
                    case 't' -> text.append('\t');
                    case '"' -> text.append('"');
                    case '\\' -> text.append('\\');
                    default -> text.append('\\').append(escaped);
                }
            } else {
                text.append(c);
            }
        }
        if (isAtEnd()) {
            throw error("Unterminated double-quoted string", startLine);
        }
        advance();
        return text.toString();
    }

    private String singleQuoted(int startLine) {
        int start = current;
        while (!isAtEnd() && peek() != '\'') {
            advance();
        }
        if (isAtEnd()) {
            throw error("Unterminated single-quoted string", startLine);
        }
        String text = source.substring(start, current);
        advance();
        return text;
    }

    private String unquoted() {
        int start = current;
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c) || c == ';' || c == '{' || c == '}' || c == '"' || c == '\'') {
                break;
            }
            if (c == '/' && (peekNext() == '/' || peekNext() == '*')) {
                break;
            }
            advance();
        }
        return source.substring(start, current);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekNext() == '*') {
                int startLine = line;
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
                    advance();
                }
                if (isAtEnd()) {
                    throw error("Unterminated block comment", startLine);
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private void addToken(TokenType type, String text, int tokenLine, int tokenColumn) {
        tokens.add(new Token(type, text, tokenLine, tokenColumn));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private ModelProcessingException error(String message, int atLine) {
        return new ModelProcessingException(sourceName + ":" + atLine + ": " + message);
    }
}
