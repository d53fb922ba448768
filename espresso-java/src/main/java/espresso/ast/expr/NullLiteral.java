package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record NullLiteral() implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.NULL_LITERAL; }

    @Override
    public String render(RenderContext ctx) {
        return "nullptr";
    }
}
