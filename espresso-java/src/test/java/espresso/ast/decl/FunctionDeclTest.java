package espresso.ast.decl;

import espresso.ast.Body;
import espresso.ast.Modifier;
import espresso.ast.expr.BinaryExpr;
import espresso.ast.expr.Identifier;
import espresso.ast.expr.NumericLiteral;
import espresso.ast.stmt.ReturnStmt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionDeclTest {

    private static Body returning(String name) {
        return Body.builder(1).add(new ReturnStmt(new Identifier(name))).build();
    }

    @Test
    void render_positional_and_named_forms() {
        var body = Body.builder(1)
                .add(new ReturnStmt(new BinaryExpr(BinaryExpr.Operator.ADD, new Identifier("a"), new Identifier("b"))))
                .build();
        var f = new FunctionDecl("int", "add",
                List.of(new Param("int", "a"), new Param("int", "b", NumericLiteral.of("1"))), body);

        assertEquals("""
            EspressoInt add(EspressoInt a, EspressoInt b = 1) {
                return a + b;
            }

            struct add_Params {
                EspressoInt _a;
                EspressoInt _b = 1;
            };
            EspressoInt add(add_Params params) {
                EspressoInt a = params._a;
                EspressoInt b = params._b;
                return a + b;
            }""", f.render());
    }

    @Test
    void render_without_params_has_no_overload() {
        var f = new FunctionDecl("void", "run", List.of(), Body.empty(1));
        assertEquals("void run() {\n}", f.render());
    }

    @Test
    void render_constructor_without_return_type() {
        var f = new FunctionDecl(null, "Point", List.of(), Body.empty(1));
        assertEquals("Point() {\n}", f.render());
    }

    @Test
    void render_abstract_as_pure_virtual() {
        var f = new FunctionDecl(List.of(Modifier.ABSTRACT), "double", "area", null, List.of(), null, null);
        assertTrue(f.isAbstract());
        assertEquals("virtual EspressoDouble area() = 0;", f.render());
    }

    @Test
    void render_bodiless_prototype() {
        var f = new FunctionDecl("int", "f", List.of(new Param("int", "x")), null);
        assertEquals("EspressoInt f(EspressoInt x);", f.render());
    }

    @Test
    void override_only_on_positional_form() {
        var f = new FunctionDecl(List.of(Modifier.OVERRIDE), "void", "draw", null,
                List.of(new Param("int", "x")), List.of(Modifier.CONST), Body.empty(1));

        assertEquals("""
            void draw(EspressoInt x) const override {
            }

            struct draw_Params {
                EspressoInt _x;
            };
            void draw(draw_Params params) const {
                EspressoInt x = params._x;
            }""", f.render());
    }

    @Test
    void generic_function_templates_the_struct() {
        var f = new FunctionDecl(null, "T", "id", List.of(GenericParam.typeParam("T")),
                List.of(new Param("T", "v")), null, returning("v"));

        assertEquals("""
            template<typename T>
            T id(T v) {
                return v;
            }

            template<typename T>
            struct id_Params {
                T _v;
            };
            template<typename T>
            T id(id_Params<T> params) {
                T v = params._v;
                return v;
            }""", f.render());
    }

    @Test
    void struct_argument_avoids_parameter_names() {
        var f = new FunctionDecl("int", "f",
                List.of(new Param("int", "params"), new Param("int", "_params")), returning("params"));
        String out = f.render();
        assertTrue(out.contains("EspressoInt f(f_Params __params) {"), out);
        assertTrue(out.contains("    EspressoInt params = __params._params;"), out);
        assertTrue(out.contains("    EspressoInt _params = __params.__params;"), out);
    }

    @Test
    void value_generic_with_default() {
        var n = new GenericParam("int", "N", "4");
        assertFalse(n.isTypeParam());
        assertEquals("EspressoInt N = 4", n.render());
        assertEquals("typename T = EspressoInt", new GenericParam(null, "T", "int").render());
    }

    @Test
    void duplicate_generic_parameter() {
        var e = assertThrows(IllegalArgumentException.class, () -> new FunctionDecl(null, "void", "f",
                List.of(GenericParam.typeParam("T"), GenericParam.typeParam("T")), List.of(), null, Body.empty(1)));
        assertTrue(e.getMessage().contains("'T'"));
    }
}
