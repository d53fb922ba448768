package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

/** Plain or qualified name ({@code x}, {@code std::cout}). */
public record Identifier(String name) implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.IDENTIFIER; }

    @Override
    public String render(RenderContext ctx) {
        return name.startsWith("this.") ? "this->" + name.substring(5) : name;
    }
}
