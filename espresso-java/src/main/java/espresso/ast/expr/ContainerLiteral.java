package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** {@code [a, b]}, {@code {a, b}} and {@code (a, b)}. */
public record ContainerLiteral(Shape shape, List<Expr> items) implements Expr {

    public enum Shape { LIST, SET, TUPLE }

    public ContainerLiteral {
        items = items == null ? new ArrayList<>() : List.copyOf(items);
    }

    @Override
    public NodeKind kind() { return NodeKind.CONTAINER_LITERAL; }

    @Override
    public String render(RenderContext ctx) {
        String joined = items.stream().map(i -> i.render(ctx)).collect(Collectors.joining(", "));
        if (shape == Shape.TUPLE) {
            ctx.include("<tuple>");
            return "std::make_tuple(" + joined + ")";
        }
        return "{" + joined + "}";
    }
}
