package espresso.ast.stmt;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;

public record ReturnStmt(Expr value) implements Stmt {

    @Override
    public NodeKind kind() { return NodeKind.RETURN; }

    @Override
    public String render(RenderContext ctx) {
        return value == null ? "return;" : "return " + value.render(ctx) + ";";
    }
}
