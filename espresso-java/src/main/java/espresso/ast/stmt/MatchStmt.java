package espresso.ast.stmt;

import espresso.ast.Body;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.expr.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code match v { case 1, 2 {...} default {...} }}, lowered to an if / else-if chain on {@code ==}.
 */
public record MatchStmt(Expr subject, List<Case> cases, Body defaultBody) implements Stmt {

    public record Case(List<Expr> patterns, Body body) {
        public Case {
            patterns = List.copyOf(patterns);
            if (patterns.isEmpty()) throw new IllegalArgumentException("case without a pattern");
        }
    }

    public MatchStmt {
        cases = cases == null ? new ArrayList<>() : List.copyOf(cases);
    }

    @Override
    public NodeKind kind() { return NodeKind.MATCH; }

    @Override
    public String render(RenderContext ctx) {
        String value = subject.render(ctx);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cases.size(); i++) {
            Case c = cases.get(i);
            String test = c.patterns().stream()
                    .map(p -> value + " == " + p.render(ctx))
                    .collect(Collectors.joining(" || "));
            sb.append(i == 0 ? "if (" : " else if (").append(test).append(") ").append(c.body().renderBlock(ctx));
        }
        if (defaultBody != null) {
            if (!cases.isEmpty()) sb.append(" else ");
            sb.append(defaultBody.renderBlock(ctx));
        }
        return sb.toString();
    }
}
