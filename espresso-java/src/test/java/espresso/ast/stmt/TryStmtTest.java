package espresso.ast.stmt;

import espresso.ast.Body;
import espresso.ast.expr.Identifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TryStmtTest {

    private static Body call(String name) {
        return Body.builder(1).add(new Identifier(name)).build();
    }

    @Test
    void try_without_handlers_rethrows() {
        var t = new TryStmt(call("a"), List.of(), null);
        assertEquals("""
            try {
                a;
            } catch (...) {
                throw;
            }""", t.render());
    }

    @Test
    void catch_clause_forms() {
        var t = new TryStmt(call("a"), List.of(
                new TryStmt.Catch("Error", "e", Body.empty(1)),
                new TryStmt.Catch("Other", null, Body.empty(1)),
                new TryStmt.Catch(null, null, call("b"))
        ), null);
        assertEquals("""
            try {
                a;
            } catch (const Error& e) {
            } catch (const Other&) {
            } catch (...) {
                b;
            }""", t.render());
    }

    @Test
    void finally_wraps_handlers_and_runs_on_both_paths() {
        var t = new TryStmt(call("a"), List.of(new TryStmt.Catch("Error", "e", call("b"))), call("c"));
        assertEquals("""
            try {
                try {
                    a;
                } catch (const Error& e) {
                    b;
                }
            } catch (...) {
                c;
                throw;
            }
            c;""", t.render());
    }

    @Test
    void finally_without_catches() {
        var t = new TryStmt(call("a"), null, call("c"));
        assertEquals("""
            try {
                a;
            } catch (...) {
                c;
                throw;
            }
            c;""", t.render());
    }
}
