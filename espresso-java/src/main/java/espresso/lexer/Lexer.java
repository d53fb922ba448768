package espresso.lexer;

import espresso.TranspilerOptions;

import java.util.*;

/**
 * Brace-dialect tokenizer. Runs in three passes: foreign block extraction, scanning, and the
 * generic merge that fuses {@code Name<...>} into one {@link TokenType#TYPE} token.
 */
public class Lexer {

    private final String source;
    private final String foreignMarker;

    private String text;
    private List<Token> tokens;

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("func", TokenType.FUNC),
            Map.entry("class", TokenType.CLASS),
            Map.entry("if", TokenType.IF),
            Map.entry("elif", TokenType.ELIF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("for", TokenType.FOR),
            Map.entry("in", TokenType.IN),
            Map.entry("match", TokenType.MATCH),
            Map.entry("switch", TokenType.SWITCH),
            Map.entry("case", TokenType.CASE),
            Map.entry("default", TokenType.DEFAULT),
            Map.entry("try", TokenType.TRY),
            Map.entry("catch", TokenType.CATCH),
            Map.entry("finally", TokenType.FINALLY),
            Map.entry("throw", TokenType.THROW),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("lambda", TokenType.LAMBDA),
            Map.entry("public", TokenType.PUBLIC),
            Map.entry("private", TokenType.PRIVATE),
            Map.entry("protected", TokenType.PROTECTED),
            Map.entry("const", TokenType.CONST),
            Map.entry("constexpr", TokenType.CONSTEXPR),
            Map.entry("static", TokenType.STATIC),
            Map.entry("abstract", TokenType.ABSTRACT),
            Map.entry("override", TokenType.OVERRIDE),
            Map.entry("virtual", TokenType.VIRTUAL),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("true", TokenType.BOOL_LITERAL),
            Map.entry("false", TokenType.BOOL_LITERAL),
            Map.entry("null", TokenType.NULL_LITERAL),
            Map.entry("none", TokenType.NULL_LITERAL)
    );

    /** Declared-type keywords; they lex as {@link TokenType#TYPE}. */
    public static final Set<String> TYPE_KEYWORDS = Set.of(
            "byte", "short", "int", "long", "dlong",
            "ubyte", "ushort", "uint", "ulong", "dulong",
            "float8", "float16", "float", "double", "decimal",
            "bin", "hex", "oct", "char", "string", "bool", "void", "any",
            "list", "collection", "map", "set", "tuple", "auto", "union"
    );

    public Lexer(String source) {
        this(source, TranspilerOptions.DEFAULT_FOREIGN_MARKER);
    }

    public Lexer(String source, String foreignMarker) {
        this.source = source;
        this.foreignMarker = foreignMarker;
    }

    private Lexer(String fragment, int line, int col) {
        this.source = fragment;
        this.foreignMarker = TranspilerOptions.DEFAULT_FOREIGN_MARKER;
        this.text = fragment;
        this.line = line;
        this.col = col;
    }

    public static LexResult lex(String source) {
        return new Lexer(source).tokenize();
    }

    public LexResult tokenize() {
        ForeignBlockExtractor.Extraction extraction = new ForeignBlockExtractor(source, foreignMarker).extract();
        text = extraction.source();

        List<Token> raw = scan();
        raw.add(new Token(TokenType.EOF, "", line, col));

        List<Token> merged = new GenericMerger(raw, extraction.blocks()).merge();
        return new LexResult(merged, extraction.blocks());
    }

    /**
     * Scans a piece of already extracted text that starts at the given position.
     * No EOF is appended and no merge runs; used by the indentation lexer per line.
     */
    static List<Token> scanFragment(String fragment, int line, int col) {
        return new Lexer(fragment, line, col).scan();
    }

    // ================= scanning =================

    private List<Token> scan() {
        tokens = new ArrayList<>();

        while (!isAtEnd()) {
            skipWhitespace();
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '+' -> {
                    if (match('+')) add(TokenType.INC, "++", startLine, startCol);
                    else if (match('=')) add(TokenType.PLUS_ASSIGN, "+=", startLine, startCol);
                    else add(TokenType.PLUS, "+", startLine, startCol);
                }
                case '-' -> {
                    if (match('-')) add(TokenType.DEC, "--", startLine, startCol);
                    else if (match('=')) add(TokenType.MINUS_ASSIGN, "-=", startLine, startCol);
                    else if (match('>')) add(TokenType.ARROW, "->", startLine, startCol);
                    else add(TokenType.MINUS, "-", startLine, startCol);
                }
                case '*' -> {
                    boolean assign = match('=');
                    add(assign ? TokenType.STAR_ASSIGN : TokenType.STAR, assign ? "*=" : "*", startLine, startCol);
                }
                case '%' -> {
                    boolean assign = match('=');
                    add(assign ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT, assign ? "%=" : "%", startLine, startCol);
                }
                case '^' -> {
                    boolean assign = match('=');
                    add(assign ? TokenType.CARET_ASSIGN : TokenType.CARET, assign ? "^=" : "^", startLine, startCol);
                }
                case '~' -> add(TokenType.TILDE, "~", startLine, startCol);
                case '?' -> add(TokenType.QUESTION, "?", startLine, startCol);

                case '=' -> {
                    if (match('=')) add(TokenType.EQ, "==", startLine, startCol);
                    else if (match('>')) add(TokenType.FAT_ARROW, "=>", startLine, startCol);
                    else add(TokenType.ASSIGN, "=", startLine, startCol);
                }
                case '!' -> {
                    boolean neq = match('=');
                    add(neq ? TokenType.NEQ : TokenType.NOT, neq ? "!=" : "!", startLine, startCol);
                }

                case '<' -> lessThan(startLine, startCol);

                case '>' -> {
                    if (peek() == '>' && peekNext() == '=') {
                        advance();
                        advance();
                        add(TokenType.SHR_ASSIGN, ">>=", startLine, startCol);
                    } else if (match('>')) {
                        add(TokenType.SHR, ">>", startLine, startCol);
                    } else {
                        boolean ge = match('=');
                        add(ge ? TokenType.GE : TokenType.GT, ge ? ">=" : ">", startLine, startCol);
                    }
                }

                case '&' -> {
                    if (match('&')) add(TokenType.AND, "&&", startLine, startCol);
                    else if (match('=')) add(TokenType.AMP_ASSIGN, "&=", startLine, startCol);
                    else add(TokenType.AMP, "&", startLine, startCol);
                }

                case '|' -> {
                    if (match('|')) add(TokenType.OR, "||", startLine, startCol);
                    else if (match('=')) add(TokenType.PIPE_ASSIGN, "|=", startLine, startCol);
                    else add(TokenType.PIPE, "|", startLine, startCol);
                }

                case '/' -> {
                    if (match('/')) {
                        skipComment();
                    } else if (match('*')) {
                        skipBlockComment(startLine, startCol);
                    } else if (match('=')) {
                        add(TokenType.SLASH_ASSIGN, "/=", startLine, startCol);
                    } else {
                        add(TokenType.SLASH, "/", startLine, startCol);
                    }
                }

                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol);
                case '[' -> add(TokenType.LBRACKET, "[", startLine, startCol);
                case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
                case ':' -> add(TokenType.COLON, ":", startLine, startCol);
                case ';' -> add(TokenType.SEMICOLON, ";", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);
                case '.' -> add(TokenType.DOT, ".", startLine, startCol);

                case '"' -> stringLiteral(startLine, startCol);
                case '\'' -> charLiteral(startLine, startCol);
                case '@' -> decorator(startLine, startCol);

                default -> {
                    if (c == 'R' && peek() == '"') {
                        advance();
                        rawStringLiteral(startLine, startCol);
                    } else if (c == '$' && peek() == '"') {
                        advance();
                        interpolatedLiteral(startLine, startCol);
                    } else if (isDigit(c)) {
                        numberLiteral(c, startLine, startCol);
                    } else if (isAlpha(c)) {
                        identifier(c, startLine, startCol);
                    } else {
                        error("Unexpected character: " + c, startLine, startCol);
                    }
                }
            }
        }

        return tokens;
    }

    // ================= helpers =================

    private void lessThan(int line, int col) {
        int end = angleSpanEnd();
        if (end > 0) {
            String inner = text.substring(pos, end - 1).strip();
            while (pos < end) advance();
            add(TokenType.ANGLE_PATH, "<" + inner + ">", line, col);
            return;
        }

        if (peek() == '<' && peekNext() == '=') {
            advance();
            advance();
            add(TokenType.SHL_ASSIGN, "<<=", line, col);
        } else if (match('<')) {
            add(TokenType.SHL, "<<", line, col);
        } else {
            boolean le = match('=');
            add(le ? TokenType.LE : TokenType.LT, le ? "<=" : "<", line, col);
        }
    }

    /**
     * End offset (exclusive) of a {@code <...>} span that opens at {@code pos - 1}, or -1 when the
     * {@code <} should lex as an operator. The span must close on the same line and hold only
     * type-ish characters. After {@code @include} any text up to {@code >} is accepted.
     */
    private int angleSpanEnd() {
        if (isAfterInclude()) {
            int i = pos;
            while (i < text.length() && text.charAt(i) != '>' && text.charAt(i) != '\n') i++;
            return i < text.length() && text.charAt(i) == '>' && i > pos ? i + 1 : -1;
        }

        char first = peek();
        if (first == '<' || first == '=' || first == '>') return -1;

        int depth = 1;
        int square = 0;
        boolean sawName = false;
        int i = pos;
        while (i < text.length()) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';

            if (c == '\n') return -1;
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth == 0) {
                    if (next == '=' || square != 0 || !sawName) return -1;
                    return i + 1;
                }
            } else if (c == '[') {
                square++;
            } else if (c == ']') {
                if (--square < 0) return -1;
            } else if (c == '=') {
                if (next == '=') return -1;
            } else if (c == '&') {
                if (next == '&') return -1;
            } else if (c == ':') {
                if (next != ':') return -1;
                i++;
            } else if (isAlphaNumeric(c)) {
                sawName = true;
            } else if (!(c == ' ' || c == '\t' || c == ',' || c == '.' || c == '*')) {
                return -1;
            }
            i++;
        }
        return -1;
    }

    private boolean isAfterInclude() {
        if (tokens.isEmpty()) return false;
        Token last = tokens.get(tokens.size() - 1);
        return last.type() == TokenType.DECORATOR && last.lexeme().equals("@include");
    }

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        if (first == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'b' || peek() == 'B'
                || peek() == 'o' || peek() == 'O')) {
            sb.append(advance());
            // digits and suffix letters alike; the literal node splits them
            while (!isAtEnd() && isAlphaNumeric(peek())) {
                sb.append(advance());
            }
            add(TokenType.NUMBER_LITERAL, sb.toString(), line, col);
            return;
        }

        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            sb.append(advance());
        }

        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            sb.append(advance());
            while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
                sb.append(advance());
            }
        }

        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            sb.append(advance());
            if (peek() == '+' || peek() == '-') sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }

        // suffix: u8, i64, UL, f32, F ...
        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        add(TokenType.NUMBER_LITERAL, sb.toString(), line, col);
    }

    private void identifier(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);
        boolean path = false;

        while (!isAtEnd()) {
            if (isAlphaNumeric(peek())) {
                sb.append(advance());
            } else if (peek() == ':' && peekNext() == ':' && isAlpha(peekAt(2))) {
                sb.append(advance()).append(advance());
                path = true;
            } else {
                break;
            }
        }

        String name = sb.toString();
        if (path) {
            add(TokenType.PATH, name, line, col);
        } else if (TYPE_KEYWORDS.contains(name)) {
            add(TokenType.TYPE, name, line, col);
        } else {
            add(keywords.getOrDefault(name, TokenType.IDENTIFIER), name, line, col);
        }
    }

    private void decorator(int line, int col) {
        if (!isAlpha(peek())) error("Expected decorator name after '@'", line, col);
        StringBuilder sb = new StringBuilder("@");
        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }
        add(TokenType.DECORATOR, sb.toString(), line, col);
    }

    private void stringLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') error("Unterminated string", line, col);
            if (c == '\\') {
                if (isAtEnd()) break;
                escape(sb, line, col);
                continue;
            }
            sb.append(c);
        }

        if (isAtEnd()) error("Unterminated string", line, col);

        advance(); // closing "
        add(TokenType.STRING_LITERAL, sb.toString(), line, col);
    }

    private void rawStringLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            sb.append(advance());
        }
        if (isAtEnd()) error("Unterminated raw string", line, col);

        advance();
        add(TokenType.RAW_STRING_LITERAL, sb.toString(), line, col);
    }

    /** Body of {@code $"..."}; quotes inside {@code {...}} belong to the embedded expression. */
    private void interpolatedLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();
        int depth = 0;

        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') error("Unterminated interpolated string", line, col);
            if (c == '"' && depth == 0) break;

            advance();
            if (c == '\\' && !isAtEnd()) {
                sb.append(c).append(advance());
                continue;
            }
            if (c == '{') depth++;
            else if (c == '}' && depth > 0) depth--;
            sb.append(c);
        }

        if (isAtEnd()) error("Unterminated interpolated string", line, col);

        advance();
        add(TokenType.INTERP_STRING_LITERAL, sb.toString(), line, col);
    }

    /** Keeps the escape as written; the C++ side understands the same escapes. */
    private void charLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '\'') {
            char c = advance();
            if (c == '\n') error("Unterminated char literal", line, col);
            sb.append(c);
            if (c == '\\' && !isAtEnd()) sb.append(advance());
        }
        if (isAtEnd()) error("Unterminated char literal", line, col);
        if (sb.length() == 0) error("Empty char literal", line, col);

        advance();
        add(TokenType.CHAR_LITERAL, sb.toString(), line, col);
    }

    /** Decodes the escape after a backslash; an unknown one keeps its backslash. */
    private void escape(StringBuilder sb, int line, int col) {
        char c = advance();
        switch (c) {
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            case '0' -> sb.append('\0');
            case 'a' -> sb.append('\007');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'v' -> sb.append('\013');
            case '"', '\'', '\\', '?' -> sb.append(c);
            case 'x' -> sb.appendCodePoint(hexEscape(Integer.MAX_VALUE, line, col));
            case 'u' -> sb.appendCodePoint(hexEscape(4, line, col));
            case 'U' -> sb.appendCodePoint(hexEscape(8, line, col));
            default -> sb.append('\\').append(c);
        }
    }

    /** Reads hex digits: at most {@code maxDigits}, and exactly that many unless unbounded. */
    private int hexEscape(int maxDigits, int line, int col) {
        StringBuilder digits = new StringBuilder();
        while (!isAtEnd() && digits.length() < maxDigits && Character.digit(peek(), 16) >= 0) {
            digits.append(advance());
        }
        boolean exact = maxDigits == Integer.MAX_VALUE ? digits.length() > 0 : digits.length() == maxDigits;
        if (!exact || digits.length() > 8) error("Invalid escape sequence", line, col);

        long value = Long.parseLong(digits.toString(), 16);
        if (value > Character.MAX_CODE_POINT) error("Invalid escape sequence", line, col);
        return (int) value;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') advance();
            else return;
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private void skipBlockComment(int line, int col) {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        error("Unterminated block comment", line, col);
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (text.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : text.charAt(pos);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        return pos + offset >= text.length() ? '\0' : text.charAt(pos + offset);
    }

    private boolean isAtEnd() {
        return pos >= text.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private void error(String message, int line, int col) {
        throw new LexerException(message, line, col);
    }
}
