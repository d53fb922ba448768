package espresso.parser;

import espresso.TranspileException;
import espresso.lexer.Token;

public class ParseException extends TranspileException {

    private final transient Token token;
    private final String expected;

    public ParseException(String message, Token token, String expected) {
        super(message + " (got " + token.type() + " '" + token.lexeme() + "')", token.line(), token.column());
        this.token = token;
        this.expected = expected;
    }

    public ParseException(String message, Token token, String expected, Throwable cause) {
        super(message + " (got " + token.type() + " '" + token.lexeme() + "')", token.line(), token.column(), cause);
        this.token = token;
        this.expected = expected;
    }

    /** Token the parser stopped at. */
    public Token token() { return token; }

    /** Construct the parser was looking for, may be null. */
    public String expected() { return expected; }
}
