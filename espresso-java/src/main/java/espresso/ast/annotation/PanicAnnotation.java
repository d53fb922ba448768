package espresso.ast.annotation;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;

public record PanicAnnotation(Expr message) implements Annotation {

    @Override
    public NodeKind kind() { return NodeKind.PANIC; }

    @Override
    public String render(RenderContext ctx) {
        ctx.include("<iostream>");
        ctx.include("<cstdlib>");
        return "std::cerr << " + message.render(ctx) + " << std::endl;\nstd::abort();";
    }
}
