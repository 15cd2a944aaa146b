package org.yangtree.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.yangtree.compiler.api.ModelProcessingException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests tokenization of YANG source text.
 */
@Tag("unit")
class LexerTest {

    private static List<Token> scan(String source) {
        return new Lexer(source, "test").scanTokens();
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    @Test
    void scansStatementWithBlock() {
        List<Token> tokens = scan("container a { leaf b; }");

        assertThat(types(tokens)).containsExactly(
                TokenType.UNQUOTED_STRING, TokenType.UNQUOTED_STRING, TokenType.BLOCK_BEGIN,
                TokenType.UNQUOTED_STRING, TokenType.UNQUOTED_STRING, TokenType.STATEMENT_END,
                TokenType.BLOCK_END);
        assertThat(tokens.get(3).text()).isEqualTo("leaf");
    }

    @Test
    void discardsCommentsAndTracksLines() {
        List<Token> tokens = scan("// header\n/* block\n comment */\nleaf x;");

        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(0).text()).isEqualTo("leaf");
        assertThat(tokens.get(0).line()).isEqualTo(4);
    }

    @Test
    void unescapesDoubleQuotedButNotSingleQuotedStrings() {
        List<Token> tokens = scan("description \"a\\tb\\n\\\"c\\\"\"; pattern '\\d+';");

        assertThat(tokens.get(1).type()).isEqualTo(TokenType.QUOTED_STRING);
        assertThat(tokens.get(1).text()).isEqualTo("a\tb\n\"c\"");
        assertThat(tokens.get(4).text()).isEqualTo("\\d+");
    }

    @Test
    void plusAfterArgumentIsConcatenation() {
        List<Token> tokens = scan("description \"a\" + \"b\";");

        assertThat(types(tokens)).containsExactly(
                TokenType.UNQUOTED_STRING, TokenType.QUOTED_STRING, TokenType.CONCAT,
                TokenType.QUOTED_STRING, TokenType.STATEMENT_END);
    }

    @Test
    void plusInsideUnquotedArgumentIsOrdinary() {
        List<Token> tokens = scan("pattern a+b;");

        assertThat(tokens.get(1).type()).isEqualTo(TokenType.UNQUOTED_STRING);
        assertThat(tokens.get(1).text()).isEqualTo("a+b");
    }

    @Test
    void unquotedArgumentStopsAtComment() {
        List<Token> tokens = scan("range 1..10// trailing\n;");

        assertThat(tokens.get(1).text()).isEqualTo("1..10");
        assertThat(tokens.get(2).type()).isEqualTo(TokenType.STATEMENT_END);
    }

    @Test
    void unterminatedStringIsFatal() {
        assertThatThrownBy(() -> scan("description \"never closed;"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("test:1")
                .hasMessageContaining("Unterminated double-quoted string");
    }

    @Test
    void unterminatedBlockCommentIsFatal() {
        assertThatThrownBy(() -> scan("leaf a; /* open"))
                .isInstanceOf(ModelProcessingException.class)
                .hasMessageContaining("Unterminated block comment");
    }
}
