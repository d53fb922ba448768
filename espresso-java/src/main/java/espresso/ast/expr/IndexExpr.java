package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record IndexExpr(Expr target, Expr index) implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.INDEX; }

    @Override
    public String render(RenderContext ctx) {
        return target.render(ctx) + "[" + index.render(ctx) + "]";
    }
}
