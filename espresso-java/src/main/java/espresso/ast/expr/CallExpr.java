package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Function call. A call with any named argument targets the {@code <name>_Params} overload:
 * {@code f(a = 1)} renders {@code f({._a = 1})}.
 */
public record CallExpr(Expr callee, List<Argument> arguments) implements Expr {

    /** {@code name} is null for positional arguments. */
    public record Argument(String name, Expr value) {
        public static Argument positional(Expr value) {
            return new Argument(null, value);
        }

        public boolean isNamed() {
            return name != null;
        }
    }

    public CallExpr {
        arguments = arguments == null ? new ArrayList<>() : List.copyOf(arguments);
    }

    public boolean hasNamedArguments() {
        return arguments.stream().anyMatch(Argument::isNamed);
    }

    @Override
    public NodeKind kind() { return NodeKind.CALL; }

    @Override
    public String render(RenderContext ctx) {
        String target = callee.render(ctx);
        if (!hasNamedArguments()) {
            return arguments.stream()
                    .map(a -> a.value().render(ctx))
                    .collect(Collectors.joining(", ", target + "(", ")"));
        }
        return arguments.stream()
                .map(a -> a.isNamed() ? "._" + a.name() + " = " + a.value().render(ctx) : a.value().render(ctx))
                .collect(Collectors.joining(", ", target + "({", "})"));
    }
}
