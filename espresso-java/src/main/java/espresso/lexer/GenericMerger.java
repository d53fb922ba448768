package espresso.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Last lexer pass. A name token directly followed by an {@link TokenType#ANGLE_PATH} on the same
 * line becomes a single {@link TokenType#TYPE} token ({@code Box} {@code <int>} -> {@code Box<int>}),
 * and every {@code __BLOCK_n__} placeholder becomes a {@link TokenType#FOREIGN_BLOCK} carrying the
 * saved block text.
 * <p>
 * The merge is positional only: {@code x < y > z} merges into {@code x<y>} followed by {@code z}.
 */
public final class GenericMerger {

    private final List<Token> input;
    private final List<String> blocks;

    public GenericMerger(List<Token> input, List<String> blocks) {
        this.input = input;
        this.blocks = blocks;
    }

    public List<Token> merge() {
        List<Token> out = new ArrayList<>(input.size());

        int i = 0;
        while (i < input.size()) {
            Token t = input.get(i);
            Token next = i + 1 < input.size() ? input.get(i + 1) : null;

            if (isMergeableName(t) && next != null
                    && next.type() == TokenType.ANGLE_PATH
                    && next.line() == t.line()) {
                out.add(new Token(TokenType.TYPE, t.lexeme() + next.lexeme(), t.line(), t.column()));
                i += 2;
                continue;
            }

            if (t.type() == TokenType.IDENTIFIER) {
                int index = ForeignBlockExtractor.placeholderIndex(t.lexeme());
                if (index >= 0) {
                    if (index >= blocks.size()) {
                        throw new LexerException("Unknown foreign block " + t.lexeme(), t.line(), t.column());
                    }
                    out.add(new Token(TokenType.FOREIGN_BLOCK, blocks.get(index), t.line(), t.column()));
                    i++;
                    continue;
                }
            }

            out.add(t);
            i++;
        }
        return out;
    }

    private static boolean isMergeableName(Token t) {
        return t.type() == TokenType.IDENTIFIER
                || t.type() == TokenType.PATH
                || t.type() == TokenType.TYPE;
    }
}
