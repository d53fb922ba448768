package espresso.lexer;

import espresso.TranspilerOptions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tokenizer for the layout dialect: blocks are opened by {@code :} plus a deeper indented line.
 * <p>
 * Works line by line on top of the brace lexer. Each logical line ends with
 * {@link TokenType#NEWLINE}; lines inside open brackets continue the logical line. Deeper lines
 * push an {@link TokenType#INDENT}, shallower ones pop one {@link TokenType#DEDENT} per level.
 */
public final class IndentationLexer {

    private final String source;
    private final String foreignMarker;
    private final int tabWidth;

    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    public IndentationLexer(String source) {
        this(source, TranspilerOptions.DEFAULT_FOREIGN_MARKER, TranspilerOptions.DEFAULT_TAB_WIDTH);
    }

    public IndentationLexer(String source, String foreignMarker, int tabWidth) {
        this.source = source;
        this.foreignMarker = foreignMarker;
        this.tabWidth = tabWidth;
    }

    public LexResult tokenize() {
        ForeignBlockExtractor.Extraction extraction = new ForeignBlockExtractor(source, foreignMarker).extract();
        String[] lines = stripComments(extraction.source()).split("\n", -1);

        indents.clear();
        indents.push(0);
        int depth = 0;

        for (int i = 0; i < lines.length; i++) {
            String text = lines[i];
            int lineNo = i + 1;

            if (depth > 0) {
                // continuation inside ( [ {
                List<Token> scanned = Lexer.scanFragment(text, lineNo, 1);
                tokens.addAll(scanned);
                depth += bracketBalance(scanned);
                if (depth <= 0) {
                    depth = 0;
                    tokens.add(new Token(TokenType.NEWLINE, "", lineNo, text.length() + 1));
                }
                continue;
            }

            if (text.isBlank()) continue;

            int lead = 0;
            int width = 0;
            while (lead < text.length() && (text.charAt(lead) == ' ' || text.charAt(lead) == '\t')) {
                width += text.charAt(lead) == '\t' ? tabWidth : 1;
                lead++;
            }

            indent(width, lineNo, lead + 1);

            List<Token> scanned = Lexer.scanFragment(text.substring(lead), lineNo, lead + 1);
            tokens.addAll(scanned);
            depth = Math.max(0, bracketBalance(scanned));
            if (depth == 0) {
                tokens.add(new Token(TokenType.NEWLINE, "", lineNo, text.length() + 1));
            }
        }

        int last = lines.length;
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", last, 1));
        }
        tokens.add(new Token(TokenType.EOF, "", last, 1));

        List<Token> merged = new GenericMerger(tokens, extraction.blocks()).merge();
        return new LexResult(merged, extraction.blocks());
    }

    private void indent(int width, int line, int col) {
        int top = indents.peek();
        if (width > top) {
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, "", line, col));
            return;
        }
        while (width < indents.peek()) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", line, col));
        }
        if (width != indents.peek()) {
            throw new LexerException("Inconsistent indentation", line, col);
        }
    }

    private static int bracketBalance(List<Token> scanned) {
        int balance = 0;
        for (Token t : scanned) {
            switch (t.type()) {
                case LPAREN, LBRACKET, LBRACE -> balance++;
                case RPAREN, RBRACKET, RBRACE -> balance--;
                default -> { }
            }
        }
        return balance;
    }

    /**
     * Blanks out {@code //}, {@code #} line comments and nesting {@code /* *\/}, {@code ## ... ##}
     * block comments. Line breaks survive so line numbers stay put.
     */
    static String stripComments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();

        while (i < n) {
            char c = text.charAt(i);
            char next = i + 1 < n ? text.charAt(i + 1) : '\0';

            if (c == '"' || c == '\'') {
                int end = i + 1;
                while (end < n && text.charAt(end) != c && text.charAt(end) != '\n') {
                    if (text.charAt(end) == '\\') end++;
                    end++;
                }
                end = Math.min(n, end + 1);
                out.append(text, i, end);
                i = end;
                continue;
            }

            if ((c == '/' && next == '/') || (c == '#' && next != '#')) {
                while (i < n && text.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
                continue;
            }

            if (c == '/' && next == '*') {
                int nesting = 0;
                while (i < n) {
                    char a = text.charAt(i);
                    char b = i + 1 < n ? text.charAt(i + 1) : '\0';
                    if (a == '/' && b == '*') {
                        nesting++;
                        out.append("  ");
                        i += 2;
                    } else if (a == '*' && b == '/') {
                        nesting--;
                        out.append("  ");
                        i += 2;
                        if (nesting == 0) break;
                    } else {
                        out.append(a == '\n' ? '\n' : ' ');
                        i++;
                    }
                }
                continue;
            }

            if (c == '#') {
                // ## ... ##
                out.append("  ");
                i += 2;
                while (i < n && !(text.charAt(i) == '#' && i + 1 < n && text.charAt(i + 1) == '#')) {
                    out.append(text.charAt(i) == '\n' ? '\n' : ' ');
                    i++;
                }
                if (i < n) {
                    out.append("  ");
                    i += 2;
                }
                continue;
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }
}
