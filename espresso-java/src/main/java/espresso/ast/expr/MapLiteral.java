package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public record MapLiteral(List<Entry> entries) implements Expr {

    public record Entry(Expr key, Expr value) {}

    public MapLiteral {
        entries = entries == null ? new ArrayList<>() : List.copyOf(entries);
    }

    @Override
    public NodeKind kind() { return NodeKind.MAP_LITERAL; }

    @Override
    public String render(RenderContext ctx) {
        return entries.stream()
                .map(e -> "{" + e.key().render(ctx) + ", " + e.value().render(ctx) + "}")
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
