package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record GroupingExpr(Expr inner) implements Expr {

    /** Drops redundant outer parentheses, e.g. around an {@code if} condition. */
    public static Expr unwrap(Expr e) {
        Expr cur = e;
        while (cur instanceof GroupingExpr g) cur = g.inner();
        return cur;
    }

    @Override
    public NodeKind kind() { return NodeKind.GROUPING; }

    @Override
    public String render(RenderContext ctx) {
        return "(" + inner.render(ctx) + ")";
    }
}
