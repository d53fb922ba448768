package espresso.ast.expr;

import espresso.ast.RenderException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UnaryExprTest {

    private static final Identifier X = new Identifier("x");

    @Test
    void nested_signs_keep_apart() {
        assertEquals("- -x", new UnaryExpr("-", new UnaryExpr("-", X)).render());
        assertEquals("+ +x", new UnaryExpr("+", new UnaryExpr("+", X)).render());
        assertEquals("- --x", new UnaryExpr("-", new UnaryExpr("--", X)).render());
        assertEquals("++ +x", new UnaryExpr("++", new UnaryExpr("+", X)).render());
        assertEquals("- -5", new UnaryExpr("-", NumericLiteral.of("-5")).render());
    }

    @Test
    void different_signs_stay_together() {
        assertEquals("-+x", new UnaryExpr("-", new UnaryExpr("+", X)).render());
        assertEquals("!-x", new UnaryExpr("!", new UnaryExpr("-", X)).render());
        assertEquals("-x--", new UnaryExpr("-", new UnaryExpr("--", X, true)).render());
    }

    @Test
    void binary_only_operator_fails() {
        assertThrows(RenderException.class, () -> new UnaryExpr("*", X).render());
        assertThrows(RenderException.class, () -> new UnaryExpr("!", X, true).render());
    }
}
