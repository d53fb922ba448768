package espresso.ast.decl;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;
import espresso.types.TypeMapper;

/** Function or lambda parameter; {@code defaultValue} may be null. */
public record Param(String type, String name, Expr defaultValue) implements Decl {

    public Param(String type, String name) {
        this(type, name, null);
    }

    public String cppType() {
        return TypeMapper.convert(type);
    }

    @Override
    public NodeKind kind() { return NodeKind.PARAM; }

    @Override
    public String render(RenderContext ctx) {
        String text = cppType() + " " + name;
        return defaultValue == null ? text : text + " = " + defaultValue.render(ctx);
    }
}
