package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.RenderException;
import espresso.lexer.TokenType;

import java.util.Objects;

/** Binary operation; {@code right} is only ever missing in hand-built trees and fails rendering. */
public record BinaryExpr(Operator op, Expr left, Expr right) implements Expr {

    public enum Operator {
        OR("||", 1, NodeKind.LOGICAL),
        AND("&&", 2, NodeKind.LOGICAL),
        BIT_OR("|", 3, NodeKind.BITWISE),
        BIT_XOR("^", 4, NodeKind.BITWISE),
        BIT_AND("&", 5, NodeKind.BITWISE),
        EQ("==", 6, NodeKind.COMPARISON),
        NE("!=", 6, NodeKind.COMPARISON),
        LT("<", 7, NodeKind.COMPARISON),
        LE("<=", 7, NodeKind.COMPARISON),
        GT(">", 7, NodeKind.COMPARISON),
        GE(">=", 7, NodeKind.COMPARISON),
        SHL("<<", 8, NodeKind.BITWISE),
        SHR(">>", 8, NodeKind.BITWISE),
        ADD("+", 9, NodeKind.ARITHMETIC),
        SUB("-", 9, NodeKind.ARITHMETIC),
        MUL("*", 10, NodeKind.ARITHMETIC),
        DIV("/", 10, NodeKind.ARITHMETIC),
        MOD("%", 10, NodeKind.ARITHMETIC);

        private final String symbol;
        private final int precedence;
        private final NodeKind kind;

        Operator(String symbol, int precedence, NodeKind kind) {
            this.symbol = symbol;
            this.precedence = precedence;
            this.kind = kind;
        }

        public String symbol() { return symbol; }
        public int precedence() { return precedence; }
        public NodeKind kind() { return kind; }

        /** Binary operator for a token, or null when the token is not one. */
        public static Operator fromToken(TokenType t) {
            return switch (t) {
                case OR -> OR;
                case AND -> AND;
                case PIPE -> BIT_OR;
                case CARET -> BIT_XOR;
                case AMP -> BIT_AND;
                case EQ -> EQ;
                case NEQ -> NE;
                case LT -> LT;
                case LE -> LE;
                case GT -> GT;
                case GE -> GE;
                case SHL -> SHL;
                case SHR -> SHR;
                case PLUS -> ADD;
                case MINUS -> SUB;
                case STAR -> MUL;
                case SLASH -> DIV;
                case PERCENT -> MOD;
                default -> null;
            };
        }

        /** Operator behind a compound assignment token ({@code +=} -> {@code +}). */
        public static Operator fromCompoundAssign(TokenType t) {
            return switch (t) {
                case PLUS_ASSIGN -> ADD;
                case MINUS_ASSIGN -> SUB;
                case STAR_ASSIGN -> MUL;
                case SLASH_ASSIGN -> DIV;
                case PERCENT_ASSIGN -> MOD;
                case AMP_ASSIGN -> BIT_AND;
                case PIPE_ASSIGN -> BIT_OR;
                case CARET_ASSIGN -> BIT_XOR;
                case SHL_ASSIGN -> SHL;
                case SHR_ASSIGN -> SHR;
                default -> throw new IllegalArgumentException("Not a compound assignment: " + t);
            };
        }
    }

    public BinaryExpr {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(left, "left");
    }

    @Override
    public NodeKind kind() { return op.kind(); }

    @Override
    public String render(RenderContext ctx) {
        if (right == null) {
            throw new RenderException(kind(), "operator '" + op.symbol() + "' needs a right operand");
        }
        return left.render(ctx) + " " + op.symbol() + " " + right.render(ctx);
    }
}
