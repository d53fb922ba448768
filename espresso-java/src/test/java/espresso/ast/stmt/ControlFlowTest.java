package espresso.ast.stmt;

import espresso.ast.Body;
import espresso.ast.decl.VarDecl;
import espresso.ast.expr.BinaryExpr;
import espresso.ast.expr.GroupingExpr;
import espresso.ast.expr.Identifier;
import espresso.ast.expr.NumericLiteral;
import espresso.ast.expr.UnaryExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowTest {

    private static Body call(String name) {
        return Body.builder(1).add(new Identifier(name)).build();
    }

    @Test
    void for_clauses_lose_their_semicolon() {
        var i = new Identifier("i");
        var loop = new ForStmt(
                new VarDecl("int", "i", NumericLiteral.of("0")),
                new BinaryExpr(BinaryExpr.Operator.LT, i, NumericLiteral.of("10")),
                new UnaryExpr("++", i, true),
                Body.empty(1));
        assertEquals("for (EspressoInt i = 0; i < 10; i++) {\n}", loop.render());
        assertEquals("for (; ; ) {\n}", new ForStmt(null, null, null, Body.empty(1)).render());
    }

    @Test
    void if_condition_drops_redundant_parentheses() {
        var s = new IfStmt(List.of(new IfStmt.Branch(new GroupingExpr(new Identifier("c")), Body.empty(1))), null);
        assertEquals("if (c) {\n}", s.render());
    }

    @Test
    void match_lowers_to_if_chain() {
        var v = new Identifier("v");
        var m = new MatchStmt(v, List.of(
                new MatchStmt.Case(List.of(NumericLiteral.of("1"), NumericLiteral.of("2")), call("a")),
                new MatchStmt.Case(List.of(NumericLiteral.of("3")), Body.empty(1))
        ), call("b"));
        assertEquals("""
            if (v == 1 || v == 2) {
                a;
            } else if (v == 3) {
            } else {
                b;
            }""", m.render());
    }

    @Test
    void match_with_only_default() {
        assertEquals("{\n    b;\n}", new MatchStmt(new Identifier("v"), null, call("b")).render());
    }

    @Test
    void match_case_needs_a_pattern() {
        assertThrows(IllegalArgumentException.class, () -> new MatchStmt.Case(List.of(), Body.empty(1)));
    }

    @Test
    void foreign_block_removes_common_indentation() {
        assertEquals("int a;\n  if (a) {}", new ForeignBlock("\n    int a;\n      if (a) {}   \n\n").render());
    }

    @Test
    void foreign_block_comment_lines_lose_at_most_code_indentation() {
        assertEquals("int a;\n// note", new ForeignBlock("\n    int a;\n  // note\n").render());
    }

    @Test
    void foreign_block_with_only_comments() {
        assertEquals("// x\n  // y", new ForeignBlock("\n  // x\n    // y\n").render());
    }

    @Test
    void blank_foreign_block_renders_nothing() {
        assertEquals("", new ForeignBlock(" \n\t\n").render());
    }
}
