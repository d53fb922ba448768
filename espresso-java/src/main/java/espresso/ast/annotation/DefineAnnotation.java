package espresso.ast.annotation;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;

/** {@code @define NAME value} -> {@code #define NAME value}; value may be null. */
public record DefineAnnotation(String name, Expr value) implements Annotation {

    @Override
    public NodeKind kind() { return NodeKind.DEFINE; }

    @Override
    public String render(RenderContext ctx) {
        return value == null ? "#define " + name : "#define " + name + " " + value.render(ctx);
    }
}
