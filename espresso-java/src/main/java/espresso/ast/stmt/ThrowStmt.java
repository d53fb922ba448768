package espresso.ast.stmt;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;

public record ThrowStmt(Expr value) implements Stmt {

    @Override
    public NodeKind kind() { return NodeKind.THROW; }

    @Override
    public String render(RenderContext ctx) {
        return value == null ? "throw;" : "throw " + value.render(ctx) + ";";
    }
}
