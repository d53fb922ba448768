package espresso.ast.annotation;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;

/** {@code @assert(cond)} uses {@code assert}; with a message it throws {@code std::runtime_error}. */
public record AssertAnnotation(Expr condition, Expr message) implements Annotation {

    @Override
    public NodeKind kind() { return NodeKind.ASSERT; }

    @Override
    public String render(RenderContext ctx) {
        String cond = condition.render(ctx);
        if (message == null) {
            ctx.include("<cassert>");
            return "assert(" + cond + ");";
        }
        ctx.include("<stdexcept>");
        return "if (!(" + cond + ")) { throw std::runtime_error(" + message.render(ctx) + "); }";
    }
}
