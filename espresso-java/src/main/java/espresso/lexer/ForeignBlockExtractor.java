package espresso.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts {@code @cpp { ... }} blocks out of the source before tokenizing.
 * <p>
 * Each block is replaced by a {@code __BLOCK_n__} placeholder and its inner text (without the
 * outer brace pair) is kept at index {@code n}. Newlines swallowed by a block are re-emitted after
 * the placeholder so later tokens keep their line numbers.
 */
public final class ForeignBlockExtractor {

    public static final String PLACEHOLDER_PREFIX = "__BLOCK_";
    public static final String PLACEHOLDER_SUFFIX = "__";

    public record Extraction(String source, List<String> blocks) {
        public Extraction {
            blocks = List.copyOf(blocks);
        }
    }

    private final String source;
    private final String marker;

    public ForeignBlockExtractor(String source, String marker) {
        this.source = source;
        this.marker = marker;
    }

    public static String placeholder(int index) {
        return PLACEHOLDER_PREFIX + index + PLACEHOLDER_SUFFIX;
    }

    /** Index encoded in a placeholder lexeme, or -1 when the lexeme is not one. */
    public static int placeholderIndex(String lexeme) {
        if (!lexeme.startsWith(PLACEHOLDER_PREFIX) || !lexeme.endsWith(PLACEHOLDER_SUFFIX)) return -1;
        String digits = lexeme.substring(PLACEHOLDER_PREFIX.length(), lexeme.length() - PLACEHOLDER_SUFFIX.length());
        if (digits.isEmpty()) return -1;
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) return -1;
        }
        return Integer.parseInt(digits);
    }

    public Extraction extract() {
        StringBuilder out = new StringBuilder(source.length());
        List<String> blocks = new ArrayList<>();

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);

            // strings and comments outside blocks are copied untouched
            if (c == '"') {
                int end = skipLineString(i);
                out.append(source, i, end);
                i = end;
                continue;
            }
            if (c == '/' && i + 1 < source.length() && source.charAt(i + 1) == '/') {
                int end = source.indexOf('\n', i);
                if (end < 0) end = source.length();
                out.append(source, i, end);
                i = end;
                continue;
            }

            if (c == '/' && i + 1 < source.length() && source.charAt(i + 1) == '*') {
                int end = source.indexOf("*/", i + 2);
                end = end < 0 ? source.length() : end + 2;
                out.append(source, i, end);
                i = end;
                continue;
            }

            if (c == marker.charAt(0) && isMarkerAt(i)) {
                int open = i + marker.length();
                while (open < source.length() && Character.isWhitespace(source.charAt(open))) open++;

                if (open < source.length() && source.charAt(open) == '{') {
                    int close = findClosingBrace(open, i);
                    blocks.add(source.substring(open + 1, close));
                    out.append(placeholder(blocks.size() - 1));

                    for (int k = i; k <= close; k++) {
                        if (source.charAt(k) == '\n') out.append('\n');
                    }
                    i = close + 1;
                    continue;
                }
            }

            out.append(c);
            i++;
        }

        return new Extraction(out.toString(), blocks);
    }

    // ================= helpers =================

    private boolean isMarkerAt(int i) {
        if (!source.startsWith(marker, i)) return false;
        if (i > 0 && isNameChar(source.charAt(i - 1))) return false;
        int after = i + marker.length();
        return after >= source.length() || !isNameChar(source.charAt(after));
    }

    /** Index of the brace that closes the one at {@code open}. */
    private int findClosingBrace(int open, int markerPos) {
        int depth = 0;
        int i = open;
        while (i < source.length()) {
            char c = source.charAt(i);
            char next = i + 1 < source.length() ? source.charAt(i + 1) : '\0';

            if (c == '"' || c == '\'') {
                i = skipQuoted(i, c);
                continue;
            }
            if (c == '/' && next == '/') {
                while (i < source.length() && source.charAt(i) != '\n') i++;
                continue;
            }
            if (c == '/' && next == '*') {
                int end = source.indexOf("*/", i + 2);
                if (end < 0) break;
                i = end + 2;
                continue;
            }

            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
            i++;
        }
        throw error("Unbalanced " + marker + " block", markerPos);
    }

    /** Like {@link #skipQuoted} but never crosses a line break. */
    private int skipLineString(int start) {
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\n') return i;
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') return i + 1;
            i++;
        }
        return source.length();
    }

    /** Position right after the quoted literal starting at {@code start}; unterminated runs to the end. */
    private int skipQuoted(int start, char quote) {
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            i++;
        }
        return source.length();
    }

    private LexerException error(String message, int offset) {
        int line = 1;
        int col = 1;
        for (int k = 0; k < offset; k++) {
            if (source.charAt(k) == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
        return new LexerException(message, line, col);
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
