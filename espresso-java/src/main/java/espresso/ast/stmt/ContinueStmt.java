package espresso.ast.stmt;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record ContinueStmt() implements Stmt {

    @Override
    public NodeKind kind() { return NodeKind.CONTINUE; }

    @Override
    public String render(RenderContext ctx) {
        return "continue;";
    }
}
