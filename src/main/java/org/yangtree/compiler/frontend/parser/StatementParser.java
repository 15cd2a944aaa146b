package org.yangtree.compiler.frontend.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.yangtree.compiler.api.ModelProcessingException;
import org.yangtree.compiler.frontend.lexer.Token;
import org.yangtree.compiler.frontend.lexer.TokenType;

/**
 * Turns the token list of one module into statement events.
 * <p>
 * Grammar: {@code statement = keyword [argument] (";" | "{" statement* "}")}, where an
 * argument is a string optionally followed by {@code + string} continuations, which are
 * folded into a single argument before the listener sees it.
 */
public final class StatementParser {

    private final List<Token> tokens;
    private final String sourceName;
    private final Deque<String> openBlocks = new ArrayDeque<>();
    private int current = 0;

    public StatementParser(List<Token> tokens, String sourceName) {
        this.tokens = tokens;
        this.sourceName = sourceName;
    }

    /**
     * Parses all statements and reports them to {@code listener}.
     *
     * @throws ModelProcessingException on unexpected tokens, unbalanced braces or a block still
     *                                  open at end of input.
     */
    public void parse(IStatementListener listener) {
        while (!isAtEnd()) {
            Token token = advance();
            if (token.type() == TokenType.BLOCK_END) {
                if (openBlocks.isEmpty()) {
                    throw error("Unexpected '}' without an open block", token);
                }
                listener.leaveStatement(openBlocks.pop());
                continue;
            }
            if (token.type() != TokenType.UNQUOTED_STRING) {
                throw error("Expected a statement keyword but found " + token.type(), token);
            }
            String keyword = token.text();
            String argument = null;
            if (!isAtEnd() && peek().isString()) {
                argument = argument();
            }
            if (isAtEnd()) {
                throw error("Unexpected end of input after '" + keyword + "'", token);
            }
            Token terminator = advance();
            switch (terminator.type()) {
                case STATEMENT_END -> {
                    listener.enterStatement(keyword, argument, token.line());
                    listener.leaveStatement(keyword);
                }
                case BLOCK_BEGIN -> {
                    listener.enterStatement(keyword, argument, token.line());
                    openBlocks.push(keyword);
                }
                default -> throw error("Expected ';' or '{' after '" + keyword + "' but found '"
                        + terminator.text() + "'", terminator);
            }
        }
        if (!openBlocks.isEmpty()) {
            throw new ModelProcessingException(sourceName + ": Unexpected end of input with "
                    + openBlocks.size() + " open block(s), innermost '" + openBlocks.peek() + "'");
        }
    }

    private String argument() {
        StringBuilder text = new StringBuilder(advance().text());
        while (!isAtEnd() && peek().type() == TokenType.CONCAT) {
            Token plus = advance();
            if (isAtEnd() || peek().type() != TokenType.QUOTED_STRING) {
                throw error("Invalid argument to the right of the plus symbol", plus);
            }
            text.append(advance().text());
        }
        return text.toString();
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private Token peek() {
        return tokens.get(current);
    }

    private ModelProcessingException error(String message, Token at) {
        return new ModelProcessingException(sourceName + ":" + at.line() + ": " + message);
    }
}
