package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.types.TypeMapper;

/** A type used as a value, e.g. the callee of {@code int(x)} or {@code Box<int>(1)}. */
public record TypeName(String type) implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.IDENTIFIER; }

    @Override
    public String render(RenderContext ctx) {
        return TypeMapper.convert(type);
    }
}
