package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.RenderException;

import java.util.Set;

/**
 * Prefix ({@code !x}, {@code -x}, {@code ~x}, {@code ++x}) or postfix ({@code x++}) operation.
 * The operator is kept as text; a binary-only operator fails at render time.
 */
public record UnaryExpr(String operator, Expr operand, boolean postfix) implements Expr {

    private static final Set<String> PREFIX = Set.of("!", "-", "+", "~", "++", "--");
    private static final Set<String> POSTFIX = Set.of("++", "--");

    public UnaryExpr(String operator, Expr operand) {
        this(operator, operand, false);
    }

    @Override
    public NodeKind kind() { return NodeKind.UNARY; }

    @Override
    public String render(RenderContext ctx) {
        if (!(postfix ? POSTFIX : PREFIX).contains(operator)) {
            throw new RenderException(kind(), "'" + operator + "' is not a "
                    + (postfix ? "postfix" : "prefix") + " operator");
        }
        String inner = operand.render(ctx);
        if (postfix) return inner + operator;
        return mergesWith(inner) ? operator + " " + inner : operator + inner;
    }

    /** {@code - -x} written without the space would lex as {@code --x}. */
    private boolean mergesWith(String inner) {
        char last = operator.charAt(operator.length() - 1);
        return (last == '-' || last == '+') && !inner.isEmpty() && inner.charAt(0) == last;
    }
}
