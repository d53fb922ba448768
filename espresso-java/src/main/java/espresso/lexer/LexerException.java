package espresso.lexer;

import espresso.TranspileException;

public class LexerException extends TranspileException {

    public LexerException(String message, int line, int column) {
        super(message, line, column);
    }
}
