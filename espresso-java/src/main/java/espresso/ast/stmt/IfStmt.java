package espresso.ast.stmt;

import espresso.ast.Body;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;
import espresso.ast.expr.GroupingExpr;

import java.util.List;

public record IfStmt(
        List<Branch> branches,   // if + elif ...
        Body elseBody            // may be null
) implements Stmt {

    public record Branch(Expr condition, Body body) {}

    public IfStmt {
        branches = List.copyOf(branches);
        if (branches.isEmpty()) throw new IllegalArgumentException("if without a branch");
    }

    @Override
    public NodeKind kind() { return NodeKind.IF; }

    @Override
    public String render(RenderContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < branches.size(); i++) {
            Branch b = branches.get(i);
            sb.append(i == 0 ? "if (" : " else if (")
                    .append(GroupingExpr.unwrap(b.condition()).render(ctx))
                    .append(") ")
                    .append(b.body().renderBlock(ctx));
        }
        if (elseBody != null) sb.append(" else ").append(elseBody.renderBlock(ctx));
        return sb.toString();
    }
}
