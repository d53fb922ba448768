package espresso.ast.stmt;

import espresso.ast.Body;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;
import espresso.types.TypeMapper;

/** {@code for x in xs}; without a declared type the element binds as {@code auto&&}. */
public record ForInStmt(String type, String variable, Expr iterable, Body body) implements Stmt {

    @Override
    public NodeKind kind() { return NodeKind.FOR_IN; }

    @Override
    public String render(RenderContext ctx) {
        String decl = type == null ? "auto&&" : TypeMapper.convert(type);
        return "for (" + decl + " " + variable + " : " + iterable.render(ctx) + ") " + body.renderBlock(ctx);
    }
}
