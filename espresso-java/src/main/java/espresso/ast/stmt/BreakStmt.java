package espresso.ast.stmt;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record BreakStmt() implements Stmt {

    @Override
    public NodeKind kind() { return NodeKind.BREAK; }

    @Override
    public String render(RenderContext ctx) {
        return "break;";
    }
}
