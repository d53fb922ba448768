package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * {@code $"Hello, {name}!"}, rendered as {@code fmt::format("Hello, {0}!", name)}.
 * Both {@code {expr}} and {@code ${expr}} open an embedded expression; nested braces stay inside it.
 */
public record InterpolatedString(List<Fragment> fragments) implements Expr {

    /** Either literal text or an embedded expression. */
    public record Fragment(String text, Expr expression) {

        public static Fragment text(String text) {
            return new Fragment(text, null);
        }

        public static Fragment expr(Expr expression) {
            return new Fragment(null, expression);
        }

        public boolean isExpression() {
            return expression != null;
        }
    }

    public InterpolatedString {
        fragments = fragments == null ? new ArrayList<>() : List.copyOf(fragments);
    }

    /** Splits a template; embedded expressions are kept as raw {@link Identifier} text. */
    public static InterpolatedString parse(String template) {
        return parse(template, source -> new Identifier(source.strip()));
    }

    public static InterpolatedString parse(String template, Function<String, Expr> expressionParser) {
        List<Fragment> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            int open = -1;
            if (c == '$' && i + 1 < template.length() && template.charAt(i + 1) == '{') open = i + 1;
            else if (c == '{') open = i;

            if (open < 0) {
                current.append(c);
                i++;
                continue;
            }

            int close = matchingBrace(template, open);
            if (close < 0) {
                // no closing brace: the rest is plain text
                current.append(template, i, template.length());
                break;
            }

            if (current.length() > 0) {
                parts.add(Fragment.text(current.toString()));
                current.setLength(0);
            }
            parts.add(Fragment.expr(expressionParser.apply(template.substring(open + 1, close))));
            i = close + 1;
        }

        if (current.length() > 0) parts.add(Fragment.text(current.toString()));
        return new InterpolatedString(parts);
    }

    public long expressionCount() {
        return fragments.stream().filter(Fragment::isExpression).count();
    }

    @Override
    public NodeKind kind() { return NodeKind.INTERPOLATED_STRING; }

    @Override
    public String render(RenderContext ctx) {
        ctx.include("<fmt/format.h>");

        StringBuilder format = new StringBuilder();
        StringBuilder args = new StringBuilder();
        int position = 0;
        for (Fragment f : fragments) {
            if (f.isExpression()) {
                format.append('{').append(position++).append('}');
                args.append(", ").append(f.expression().render(ctx));
            } else {
                format.append(f.text().replace("{", "{{").replace("}", "}}"));
            }
        }
        return "fmt::format(\"" + format + "\"" + args + ")";
    }

    private static int matchingBrace(String s, int open) {
        int depth = 0;
        for (int j = open; j < s.length(); j++) {
            char c = s.charAt(j);
            if (c == '{') depth++;
            else if (c == '}' && --depth == 0) return j;
        }
        return -1;
    }
}
