package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record BoolLiteral(boolean value) implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.BOOL_LITERAL; }

    @Override
    public String render(RenderContext ctx) {
        return value ? "true" : "false";
    }
}
