package espresso.ast.annotation;

import espresso.ast.Body;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record NamespaceAnnotation(String name, Body body) implements Annotation {

    @Override
    public NodeKind kind() { return NodeKind.NAMESPACE; }

    @Override
    public String render(RenderContext ctx) {
        return "namespace " + name + " " + body.renderBlock(ctx);
    }
}
