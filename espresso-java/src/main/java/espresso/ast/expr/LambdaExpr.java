package espresso.ast.expr;

import espresso.ast.Body;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.decl.Param;
import espresso.types.TypeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code lambda(int x) -> int => x * 2} or with a block body. Captures by reference.
 * Exactly one of {@code body} and {@code expression} is set.
 */
public record LambdaExpr(List<Param> params, String returnType, Body body, Expr expression) implements Expr {

    public LambdaExpr {
        params = params == null ? new ArrayList<>() : List.copyOf(params);
        if ((body == null) == (expression == null)) {
            throw new IllegalArgumentException("lambda needs either a body or an expression");
        }
    }

    @Override
    public NodeKind kind() { return NodeKind.LAMBDA; }

    @Override
    public String render(RenderContext ctx) {
        String head = params.stream()
                .map(p -> p.render(ctx))
                .collect(Collectors.joining(", ", "[&](", ")"));
        if (returnType != null) head += " -> " + TypeMapper.convert(returnType);

        if (expression != null) {
            return head + " { return " + expression.render(ctx) + "; }";
        }
        return head + " " + body.renderBlock(ctx);
    }
}
