package espresso.lexer;

public enum TokenType {

    // literals
    NUMBER_LITERAL,
    STRING_LITERAL,
    RAW_STRING_LITERAL,
    INTERP_STRING_LITERAL,
    CHAR_LITERAL,
    BOOL_LITERAL,
    NULL_LITERAL,

    // names
    IDENTIFIER,
    PATH,
    TYPE,
    ANGLE_PATH,

    // keywords
    FUNC,
    CLASS,
    IF,
    ELIF,
    ELSE,
    WHILE,
    FOR,
    IN,
    MATCH,
    SWITCH,
    CASE,
    DEFAULT,
    TRY,
    CATCH,
    FINALLY,
    THROW,
    BREAK,
    CONTINUE,
    RETURN,
    LAMBDA,

    // modifiers
    PUBLIC,
    PRIVATE,
    PROTECTED,
    CONST,
    CONSTEXPR,
    STATIC,
    ABSTRACT,
    OVERRIDE,
    VIRTUAL,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    ASSIGN,
    PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
    AMP_ASSIGN, PIPE_ASSIGN, CARET_ASSIGN, SHL_ASSIGN, SHR_ASSIGN,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    AND, OR, NOT,
    AMP, PIPE, CARET, TILDE, SHL, SHR,
    INC, DEC,
    ARROW, FAT_ARROW,
    QUESTION,
    DOT,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COLON, SEMICOLON, COMMA,

    DECORATOR,
    FOREIGN_BLOCK,

    // layout (indentation mode only)
    NEWLINE,
    INDENT,
    DEDENT,

    EOF;

    public boolean isModifier() {
        return switch (this) {
            case PUBLIC, PRIVATE, PROTECTED, CONST, CONSTEXPR, STATIC, ABSTRACT, OVERRIDE, VIRTUAL -> true;
            default -> false;
        };
    }

    /** Compound assignment tokens ({@code +=} and friends). */
    public boolean isCompoundAssign() {
        return switch (this) {
            case PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
                 AMP_ASSIGN, PIPE_ASSIGN, CARET_ASSIGN, SHL_ASSIGN, SHR_ASSIGN -> true;
            default -> false;
        };
    }
}
