package espresso.lexer;

import java.util.List;

/**
 * Token stream plus the embedded C++ blocks cut out of the source.
 * {@code foreignBlocks.get(n)} is the text behind placeholder {@code __BLOCK_n__}.
 */
public record LexResult(List<Token> tokens, List<String> foreignBlocks) {
    public LexResult {
        tokens = List.copyOf(tokens);
        foreignBlocks = List.copyOf(foreignBlocks);
    }
}
