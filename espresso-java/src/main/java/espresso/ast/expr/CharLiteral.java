package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

/** {@code text} is the literal body as written, escapes included. */
public record CharLiteral(String text) implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.CHAR_LITERAL; }

    @Override
    public String render(RenderContext ctx) {
        return "'" + text + "'";
    }
}
