package espresso.ast.annotation;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

/** Registers a header with the program; renders nothing in place. */
public record IncludeAnnotation(String header) implements Annotation {

    @Override
    public NodeKind kind() { return NodeKind.INCLUDE; }

    @Override
    public String render(RenderContext ctx) {
        ctx.include(header);
        return "";
    }
}
