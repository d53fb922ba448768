package espresso.ast.stmt;

import espresso.ast.Body;
import espresso.ast.Node;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

/** C-style loop; any of the three clauses may be null. */
public record ForStmt(Node init, Node condition, Node update, Body body) implements Stmt {

    @Override
    public NodeKind kind() { return NodeKind.FOR; }

    @Override
    public String render(RenderContext ctx) {
        return "for (" + clause(init, ctx) + "; " + clause(condition, ctx) + "; " + clause(update, ctx) + ") "
                + body.renderBlock(ctx);
    }

    private static String clause(Node n, RenderContext ctx) {
        if (n == null) return "";
        String text = n.render(ctx);
        return text.endsWith(";") ? text.substring(0, text.length() - 1) : text;
    }
}
