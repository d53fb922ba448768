package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record VoidLiteral() implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.VOID_LITERAL; }

    @Override
    public String render(RenderContext ctx) {
        return "void";
    }
}
