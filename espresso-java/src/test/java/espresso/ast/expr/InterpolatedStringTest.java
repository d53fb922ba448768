package espresso.ast.expr;

import espresso.ast.RenderContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class InterpolatedStringTest {

    @Test
    void split_template_into_fragments() {
        var s = InterpolatedString.parse("Hello, {name}! Today is {day}.");
        assertEquals(5, s.fragments().size());
        assertEquals(2, s.expressionCount());
        assertEquals("Hello, ", s.fragments().get(0).text());
        assertEquals(new Identifier("name"), s.fragments().get(1).expression());
        assertEquals(".", s.fragments().get(4).text());
    }

    @Test
    void dollar_brace_form() {
        var s = InterpolatedString.parse("a ${x} b");
        assertEquals(1, s.expressionCount());
        assertEquals("fmt::format(\"a {0} b\", x)", s.render());
    }

    @Test
    void nested_braces_stay_in_the_expression() {
        var s = InterpolatedString.parse("v={f({1})}");
        assertEquals(new Identifier("f({1})"), s.fragments().get(1).expression());
    }

    @Test
    void unclosed_brace_is_text() {
        var s = InterpolatedString.parse("a {b");
        assertEquals(0, s.expressionCount());
        assertEquals("fmt::format(\"a {{b\")", s.render());
    }

    @Test
    void render_registers_fmt_header() {
        var ctx = new RenderContext();
        InterpolatedString.parse("{x}").render(ctx);
        assertTrue(ctx.includes().contains("<fmt/format.h>"));
    }

    @Test
    void custom_expression_parser_is_used() {
        var s = InterpolatedString.parse("{ n }", src -> NumericLiteral.of("7"));
        assertEquals("fmt::format(\"{0}\", 7)", s.render());
    }
}
