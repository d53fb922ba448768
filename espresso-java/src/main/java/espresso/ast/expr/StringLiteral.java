package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

/** Plain string; {@code value} holds the unescaped text. */
public record StringLiteral(String value) implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.STRING_LITERAL; }

    @Override
    public String render(RenderContext ctx) {
        return "\"" + escape(value) + "\"";
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\0' -> sb.append("\\0");
                case '\007' -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\013' -> sb.append("\\v");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
