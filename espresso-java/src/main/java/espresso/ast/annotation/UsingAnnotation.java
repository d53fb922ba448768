package espresso.ast.annotation;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record UsingAnnotation(String namespace) implements Annotation {

    @Override
    public NodeKind kind() { return NodeKind.USING; }

    @Override
    public String render(RenderContext ctx) {
        return "using namespace " + namespace + ";";
    }
}
