package espresso.ast.decl;

import espresso.ast.Modifier;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;
import espresso.types.TypeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** {@code int a, b} or {@code int a, b = 0}; the value initializes every name. */
public record MultiVarDecl(List<Modifier> modifiers, String type, List<String> names, Expr value) implements Decl {

    public MultiVarDecl {
        modifiers = modifiers == null ? new ArrayList<>() : List.copyOf(modifiers);
        names = List.copyOf(names);
        if (names.isEmpty()) throw new IllegalArgumentException("no variable names");
    }

    @Override
    public NodeKind kind() {
        return value == null ? NodeKind.MULTI_VAR_DECLARE : NodeKind.MULTI_VAR_ASSIGN;
    }

    @Override
    public String render(RenderContext ctx) {
        String init = value == null ? "" : " = " + value.render(ctx);
        return names.stream()
                .map(n -> n + init)
                .collect(Collectors.joining(", ",
                        Modifier.prefix(modifiers, ctx.inClass()) + TypeMapper.convert(type) + " ", ";"));
    }
}
