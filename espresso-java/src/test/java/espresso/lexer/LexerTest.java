package espresso.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize().tokens();
    }

    private static List<Token> tokensNoEof(String src) {
        return lex(src).stream().filter(t -> t.type() != TokenType.EOF).toList();
    }

    private static List<TokenType> typesNoEof(String src) {
        return tokensNoEof(src).stream().map(Token::type).toList();
    }

    private static List<String> lexemesNoEof(String src) {
        return tokensNoEof(src).stream().map(Token::lexeme).toList();
    }

    @Test
    void lex_simple_declaration() {
        assertEquals(List.of(
                TokenType.TYPE, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER_LITERAL, TokenType.SEMICOLON
        ), typesNoEof("int x = 5;"));
    }

    @Test
    void lex_ends_with_eof() {
        var toks = lex("x");
        assertEquals(TokenType.EOF, toks.get(toks.size() - 1).type());
        assertEquals(List.of(TokenType.EOF), lex("").stream().map(Token::type).toList());
    }

    @Test
    void lex_keywords() {
        var ts = typesNoEof("func class if elif else while for in match switch case default "
                + "try catch finally throw break continue return lambda");
        assertEquals(List.of(
                TokenType.FUNC, TokenType.CLASS, TokenType.IF, TokenType.ELIF, TokenType.ELSE,
                TokenType.WHILE, TokenType.FOR, TokenType.IN, TokenType.MATCH, TokenType.SWITCH,
                TokenType.CASE, TokenType.DEFAULT, TokenType.TRY, TokenType.CATCH, TokenType.FINALLY,
                TokenType.THROW, TokenType.BREAK, TokenType.CONTINUE, TokenType.RETURN, TokenType.LAMBDA
        ), ts);
    }

    @Test
    void lex_modifiers_and_word_operators() {
        var ts = typesNoEof("public private protected const constexpr static abstract override virtual and or not");
        assertEquals(List.of(
                TokenType.PUBLIC, TokenType.PRIVATE, TokenType.PROTECTED, TokenType.CONST, TokenType.CONSTEXPR,
                TokenType.STATIC, TokenType.ABSTRACT, TokenType.OVERRIDE, TokenType.VIRTUAL,
                TokenType.AND, TokenType.OR, TokenType.NOT
        ), ts);
        assertTrue(ts.subList(0, 9).stream().allMatch(TokenType::isModifier));
    }

    @Test
    void lex_literal_keywords() {
        assertEquals(List.of(TokenType.BOOL_LITERAL, TokenType.BOOL_LITERAL, TokenType.NULL_LITERAL, TokenType.NULL_LITERAL),
                typesNoEof("true false null none"));
    }

    @Test
    void lex_type_keywords_vs_identifiers() {
        assertEquals(List.of(TokenType.TYPE, TokenType.TYPE, TokenType.TYPE, TokenType.IDENTIFIER),
                typesNoEof("int string list integer"));
    }

    @Test
    void lex_scoped_name_as_path() {
        var toks = tokensNoEof("std::cout");
        assertEquals(1, toks.size());
        assertEquals(TokenType.PATH, toks.get(0).type());
        assertEquals("std::cout", toks.get(0).lexeme());
    }

    @Test
    void lex_multi_char_operators() {
        assertEquals(List.of(
                TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.INC, TokenType.DEC,
                TokenType.ARROW, TokenType.FAT_ARROW, TokenType.EQ, TokenType.NEQ,
                TokenType.LE, TokenType.GE, TokenType.AND, TokenType.OR,
                TokenType.SHL, TokenType.SHR, TokenType.SHL_ASSIGN, TokenType.SHR_ASSIGN
        ), typesNoEof("+= -= ++ -- -> => == != <= >= && || << >> <<= >>="));
    }

    @Test
    void lex_single_char_tokens() {
        assertEquals(List.of(
                TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACE, TokenType.RBRACE,
                TokenType.LBRACKET, TokenType.RBRACKET, TokenType.COLON, TokenType.SEMICOLON,
                TokenType.COMMA, TokenType.DOT, TokenType.QUESTION, TokenType.TILDE
        ), typesNoEof("(){}[]:;,.?~"));
    }

    @Test
    void lex_generic_type_merges_into_one_token() {
        var toks = tokensNoEof("Box<int> b");
        assertEquals(List.of(TokenType.TYPE, TokenType.IDENTIFIER), toks.stream().map(Token::type).toList());
        assertEquals("Box<int>", toks.get(0).lexeme());
    }

    @Test
    void lex_nested_generic_type() {
        var toks = tokensNoEof("map<string, list<int>> m");
        assertEquals("map<string, list<int>>", toks.get(0).lexeme());
        assertEquals(TokenType.TYPE, toks.get(0).type());
    }

    @Test
    void lex_comparison_is_not_a_generic() {
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.LT, TokenType.IDENTIFIER, TokenType.AND,
                TokenType.IDENTIFIER, TokenType.GT, TokenType.IDENTIFIER
        ), typesNoEof("a < b && c > d"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LT, TokenType.NUMBER_LITERAL, TokenType.SEMICOLON),
                typesNoEof("i < 10;"));
    }

    @Test
    void lex_positional_generic_ambiguity_is_kept() {
        // x < y > z reads as the type x<y> followed by z
        assertEquals(List.of("x<y>", "z"), lexemesNoEof("x < y > z"));
    }

    @Test
    void lex_include_header() {
        var toks = tokensNoEof("@include <vector>");
        assertEquals(TokenType.DECORATOR, toks.get(0).type());
        assertEquals("@include", toks.get(0).lexeme());
        assertEquals(TokenType.ANGLE_PATH, toks.get(1).type());
        assertEquals("<vector>", toks.get(1).lexeme());
    }

    @Test
    void lex_numbers_keep_their_text() {
        assertEquals(List.of("0x1F", "1_000", "3.14", "2.5e-3", "10u8", "0b1010"),
                lexemesNoEof("0x1F 1_000 3.14 2.5e-3 10u8 0b1010"));
        assertTrue(typesNoEof("0x1F 3.14 10u8").stream().allMatch(t -> t == TokenType.NUMBER_LITERAL));
    }

    @Test
    void lex_number_followed_by_member_access() {
        assertEquals(List.of(TokenType.NUMBER_LITERAL, TokenType.DOT, TokenType.IDENTIFIER), typesNoEof("12.x"));
    }

    @Test
    void lex_string_literal_is_unescaped() {
        var toks = tokensNoEof("\"a\\tb\\\"c\"");
        assertEquals(TokenType.STRING_LITERAL, toks.get(0).type());
        assertEquals("a\tb\"c", toks.get(0).lexeme());
    }

    @Test
    void lex_string_numeric_and_control_escapes() {
        var toks = tokensNoEof("\"\\x41\\u00e9\\a\\b\\f\\v\\'\\?\"");
        assertEquals("A\u00e9\007\b\f\013'?", toks.get(0).lexeme());
    }

    @Test
    void lex_string_unknown_escape_keeps_backslash() {
        assertEquals("\\q", tokensNoEof("\"\\q\"").get(0).lexeme());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"\\x\"", "\"\\u12\"", "\"\\U0011FFFF\""})
    void lex_string_invalid_hex_escape(String src) {
        var e = assertThrows(LexerException.class, () -> lex(src));
        assertEquals("Invalid escape sequence", e.detail());
    }

    @Test
    void lex_raw_interpolated_and_char_literals() {
        var toks = tokensNoEof("R\"C:\\dir\" $\"Hi {name}\" '\\n'");
        assertEquals(List.of(TokenType.RAW_STRING_LITERAL, TokenType.INTERP_STRING_LITERAL, TokenType.CHAR_LITERAL),
                toks.stream().map(Token::type).toList());
        assertEquals("C:\\dir", toks.get(0).lexeme());
        assertEquals("Hi {name}", toks.get(1).lexeme());
        assertEquals("\\n", toks.get(2).lexeme());
    }

    @Test
    void lex_interpolation_keeps_quotes_inside_braces() {
        var toks = tokensNoEof("$\"{f(\"x\")}!\"");
        assertEquals(1, toks.size());
        assertEquals("{f(\"x\")}!", toks.get(0).lexeme());
    }

    @Test
    void lex_comments_skipped() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER),
                typesNoEof("x // line\ny /* block\n comment */ z"));
    }

    @Test
    void lex_whitespace_and_positions() {
        var toks = lex("a\n  b");
        assertEquals("IDENTIFIER('a')@1:1", toks.get(0).toString());
        assertEquals("IDENTIFIER('b')@2:3", toks.get(1).toString());
    }

    @Test
    void lex_foreign_block_becomes_one_token() {
        var result = new Lexer("@cpp { int x = 1; }\nfoo").tokenize();
        assertEquals(List.of(" int x = 1; "), result.foreignBlocks());

        var toks = result.tokens();
        assertEquals(TokenType.FOREIGN_BLOCK, toks.get(0).type());
        assertEquals(" int x = 1; ", toks.get(0).lexeme());
        assertEquals("IDENTIFIER('foo')@2:1", toks.get(1).toString());
    }

    @Test
    void lex_custom_foreign_marker() {
        var result = new Lexer("@native { a; }", "@native").tokenize();
        assertEquals(List.of(" a; "), result.foreignBlocks());
        assertEquals(TokenType.FOREIGN_BLOCK, result.tokens().get(0).type());
    }

    static Stream<String> brokenInputs() {
        return Stream.of(
                "\"abc",
                "\"ab\nc\"",
                "''",
                "'a",
                "/* never closed",
                "`",
                "@",
                "@cpp { int x;"
        );
    }

    @ParameterizedTest
    @MethodSource("brokenInputs")
    void lex_errors(String input) {
        assertThrows(LexerException.class, () -> lex(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"abc", "x = `"})
    void lex_error_carries_position(String input) {
        var e = assertThrows(LexerException.class, () -> lex(input));
        assertEquals(1, e.line());
        assertTrue(e.getMessage().startsWith("[1:"));
    }

    @Test
    void lex_unbalanced_foreign_block_message() {
        var e = assertThrows(LexerException.class, () -> lex("x\n@cpp { y"));
        assertEquals("Unbalanced @cpp block", e.detail());
        assertEquals(2, e.line());
        assertEquals(1, e.column());
    }
}
