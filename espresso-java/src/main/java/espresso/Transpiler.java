package espresso;

import espresso.ast.Program;
import espresso.lexer.IndentationLexer;
import espresso.lexer.LexResult;
import espresso.lexer.Lexer;
import espresso.parser.ParseException;
import espresso.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Espresso source in, C++ source out: tokenize, parse, render.
 * <p>
 * Instances hold only their options and can be reused; every call works on fresh lexer,
 * parser and render state.
 */
public final class Transpiler {

    private static final Logger logger = LoggerFactory.getLogger(Transpiler.class);

    private final TranspilerOptions options;

    public Transpiler() {
        this(new TranspilerOptions());
    }

    public Transpiler(TranspilerOptions options) {
        this.options = options;
    }

    public TranspilerOptions options() {
        return options;
    }

    public LexResult tokenize(String source) {
        LexResult lexed = options.indentationSensitive()
                ? new IndentationLexer(source, options.foreignBlockMarker(), options.tabWidth()).tokenize()
                : new Lexer(source, options.foreignBlockMarker()).tokenize();
        logger.debug("Lexer: {} tokens, {} foreign blocks", lexed.tokens().size(), lexed.foreignBlocks().size());
        return lexed;
    }

    /**
     * @throws ParseException the first error, also in recovery mode once the whole unit was read
     */
    public Program parse(String source) {
        LexResult lexed = tokenize(source);
        Parser parser = new Parser(lexed.tokens(), lexed.foreignBlocks(), options.recoverFromErrors());
        Program program = parser.parseProgram();

        List<ParseException> errors = parser.errors();
        for (ParseException e : errors) {
            logger.warn("Recovered from parse error: {}", e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw errors.get(0);
        }

        logger.debug("Parser: {} top-level statements", program.body().children().size());
        return program.withDefaultIncludes(options.defaultIncludes());
    }

    public String transpile(String source) {
        String cpp = parse(source).render();
        logger.debug("Renderer: {} characters of C++", cpp.length());
        return cpp;
    }
}
