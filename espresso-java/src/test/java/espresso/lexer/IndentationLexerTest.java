package espresso.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IndentationLexerTest {

    private static List<TokenType> types(String src) {
        return new IndentationLexer(src).tokenize().tokens().stream().map(Token::type).toList();
    }

    @Test
    void layout_block_opens_and_closes() {
        assertEquals(List.of(
                TokenType.IF, TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER_LITERAL, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.EOF
        ), types("""
            if x:
                y = 1
            z
            """));
    }

    @Test
    void layout_dedents_at_end_of_input() {
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.DEDENT, TokenType.EOF
        ), types("a:\n  b:\n    c\n"));
    }

    @Test
    void layout_blank_lines_are_skipped() {
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF
        ), types("a\n\n   \nb"));
    }

    @Test
    void layout_brackets_continue_the_line() {
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.NUMBER_LITERAL, TokenType.COMMA,
                TokenType.NUMBER_LITERAL, TokenType.RPAREN, TokenType.NEWLINE,
                TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF
        ), types("f(1,\n      2)\nx"));
    }

    @Test
    void layout_tab_counts_as_tab_width() {
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.EOF
        ), types("a:\n\tb\n    c"));
    }

    @Test
    void layout_comments_are_stripped() {
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF
        ), types("x # note\n## block\n  still ##\n/* more */\ny // end"));
    }

    @Test
    void layout_hash_inside_string_is_kept() {
        var toks = new IndentationLexer("s = \"#1\"").tokenize().tokens();
        assertEquals("#1", toks.get(2).lexeme());
    }

    @Test
    void layout_inconsistent_indentation() {
        var e = assertThrows(LexerException.class, () -> types("a:\n    b\n  c"));
        assertEquals("Inconsistent indentation", e.detail());
        assertEquals(3, e.line());
    }

    @Test
    void layout_foreign_block_keeps_following_lines() {
        var result = new IndentationLexer("@cpp {\n  int a;\n}\ny").tokenize();
        var toks = result.tokens();
        assertEquals(TokenType.FOREIGN_BLOCK, toks.get(0).type());
        assertEquals(TokenType.NEWLINE, toks.get(1).type());
        assertEquals("IDENTIFIER('y')@4:1", toks.get(2).toString());
        assertEquals(List.of("\n  int a;\n"), result.foreignBlocks());
    }

    @Test
    void layout_merges_generics() {
        var toks = new IndentationLexer("Box<int> b").tokenize().tokens();
        assertEquals("Box<int>", toks.get(0).lexeme());
        assertEquals(TokenType.TYPE, toks.get(0).type());
    }

    @Test
    void strip_comments_keeps_line_breaks() {
        String stripped = IndentationLexer.stripComments("a /* x\ny */ b");
        assertEquals(2, stripped.split("\n", -1).length);
        assertEquals("a", stripped.split("\n")[0].strip());
        assertEquals("b", stripped.split("\n")[1].strip());
    }
}
