package espresso.ast;

import espresso.ast.annotation.IncludeAnnotation;
import espresso.ast.decl.VarDecl;
import espresso.ast.expr.NumericLiteral;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramTest {

    private static Body declaring(Node... extra) {
        var b = Body.builder(0);
        for (Node n : extra) b.add(n);
        return b.add(new VarDecl("int", "x", NumericLiteral.of("1"))).build();
    }

    @Test
    void includes_are_sorted_above_the_code() {
        var p = new Program(declaring(new IncludeAnnotation("<vector>"), new IncludeAnnotation("<algorithm>")));
        assertEquals("""
            #include <algorithm>
            #include <runtime.hpp>
            #include <vector>

            EspressoInt x = 1;
            """, p.render());
    }

    @Test
    void empty_program_has_only_includes() {
        assertEquals("#include <runtime.hpp>\n\n", new Program(Body.empty(0)).render());
    }

    @Test
    void no_default_includes() {
        var p = new Program(declaring()).withDefaultIncludes(List.of());
        assertEquals("EspressoInt x = 1;\n", p.render());
        assertEquals("", new Program(Body.empty(0), List.of()).render());
    }

    @Test
    void render_context_normalizes_headers() {
        var ctx = new RenderContext();
        ctx.include("vector");
        ctx.include("\"local.h\"");
        ctx.include("  ");
        ctx.include("<vector>");
        assertEquals(List.of("\"local.h\"", "<vector>"), List.copyOf(ctx.includes()));
    }

    @Test
    void body_indents_nested_lines_but_not_blank_ones() {
        assertEquals("    a\n\n    b", Body.indent("a\n\nb", 1));
        assertThrows(IllegalArgumentException.class, () -> Body.empty(-1));
    }
}
