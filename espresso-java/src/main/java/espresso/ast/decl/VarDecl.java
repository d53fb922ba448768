package espresso.ast.decl;

import espresso.ast.Modifier;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;
import espresso.types.TypeMapper;

import java.util.ArrayList;
import java.util.List;

/** {@code int x} or {@code int x = v}; {@code value} is null for a bare declaration. */
public record VarDecl(List<Modifier> modifiers, String type, String name, Expr value) implements Decl {

    public VarDecl {
        modifiers = modifiers == null ? new ArrayList<>() : List.copyOf(modifiers);
    }

    public VarDecl(String type, String name, Expr value) {
        this(null, type, name, value);
    }

    @Override
    public NodeKind kind() {
        return value == null ? NodeKind.VAR_DECLARE : NodeKind.VAR_ASSIGN;
    }

    @Override
    public String render(RenderContext ctx) {
        String text = Modifier.prefix(modifiers, ctx.inClass()) + TypeMapper.convert(type) + " " + name;
        if (value != null) text += " = " + value.render(ctx);
        return text + ";";
    }
}
