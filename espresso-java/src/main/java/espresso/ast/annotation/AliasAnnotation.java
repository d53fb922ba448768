package espresso.ast.annotation;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.types.TypeMapper;

public record AliasAnnotation(String name, String type) implements Annotation {

    @Override
    public NodeKind kind() { return NodeKind.ALIAS; }

    @Override
    public String render(RenderContext ctx) {
        return "using " + name + " = " + TypeMapper.convert(type) + ";";
    }
}
