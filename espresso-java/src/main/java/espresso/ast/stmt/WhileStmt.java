package espresso.ast.stmt;

import espresso.ast.Body;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;
import espresso.ast.expr.GroupingExpr;

public record WhileStmt(Expr condition, Body body) implements Stmt {

    @Override
    public NodeKind kind() { return NodeKind.WHILE; }

    @Override
    public String render(RenderContext ctx) {
        return "while (" + GroupingExpr.unwrap(condition).render(ctx) + ") " + body.renderBlock(ctx);
    }
}
