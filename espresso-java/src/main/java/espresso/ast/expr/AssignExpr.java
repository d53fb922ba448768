package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

/** {@code target = value}; compound forms arrive already desugared. */
public record AssignExpr(Expr target, Expr value) implements Expr {

    public static boolean isAssignable(Expr e) {
        return e instanceof Identifier || e instanceof MemberAccessExpr || e instanceof IndexExpr;
    }

    @Override
    public NodeKind kind() { return NodeKind.ASSIGNMENT; }

    @Override
    public String render(RenderContext ctx) {
        return target.render(ctx) + " = " + value.render(ctx);
    }
}
