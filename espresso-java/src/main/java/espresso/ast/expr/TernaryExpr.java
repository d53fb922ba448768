package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record TernaryExpr(Expr condition, Expr whenTrue, Expr whenFalse) implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.TERNARY; }

    @Override
    public String render(RenderContext ctx) {
        return condition.render(ctx) + " ? " + whenTrue.render(ctx) + " : " + whenFalse.render(ctx);
    }
}
