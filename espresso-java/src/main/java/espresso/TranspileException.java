package espresso;

/**
 * Root of every error raised while turning Espresso source into C++.
 * Position is 1-based; 0 means the position is unknown.
 */
public class TranspileException extends RuntimeException {

    private final int line;
    private final int column;
    private final String detail;

    public TranspileException(String detail, int line, int column) {
        super(format(detail, line, column));
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    public TranspileException(String detail, int line, int column, Throwable cause) {
        super(format(detail, line, column), cause);
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    public int line() { return line; }
    public int column() { return column; }

    /** Message without the position prefix. */
    public String detail() { return detail; }

    private static String format(String detail, int line, int column) {
        if (line <= 0) return detail;
        return "[" + line + ":" + column + "] " + detail;
    }
}
