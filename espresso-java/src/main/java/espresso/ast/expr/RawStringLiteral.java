package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record RawStringLiteral(String value) implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.RAW_STRING_LITERAL; }

    @Override
    public String render(RenderContext ctx) {
        return "R\"(" + value + ")\"";
    }
}
