package espresso.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered statements of a block. {@code indentLevel} is relative to the enclosing construct:
 * 0 for the program, 1 for anything nested in braces.
 */
public record Body(List<Node> children, int indentLevel) {

    public static final String INDENT = "    ";

    public Body {
        children = List.copyOf(children);
        if (indentLevel < 0) throw new IllegalArgumentException("negative indent: " + indentLevel);
    }

    public static Body empty(int indentLevel) {
        return new Body(new ArrayList<>(), indentLevel);
    }

    public static Builder builder(int indentLevel) {
        return new Builder(indentLevel);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public String render(RenderContext ctx) {
        List<String> lines = new ArrayList<>();
        for (Node child : children) {
            String text = renderStatement(child, ctx);
            if (text.isEmpty()) continue;
            lines.add(indent(text, indentLevel));
        }
        return String.join("\n", lines);
    }

    /** Body wrapped in braces, {@code {\n}} when empty. */
    public String renderBlock(RenderContext ctx) {
        String inner = render(ctx);
        return inner.isEmpty() ? "{\n}" : "{\n" + inner + "\n}";
    }

    /** Child text with {@code ;} appended to value-producing nodes that lack one. */
    public static String renderStatement(Node child, RenderContext ctx) {
        String text = child.render(ctx);
        if (text.isEmpty()) return text;
        if (child.isValueProducing() && !text.endsWith(";")) return text + ";";
        return text;
    }

    /** Prefixes every non-blank line with {@code level} indents. */
    public static String indent(String text, int level) {
        if (level == 0) return text;
        String pad = INDENT.repeat(level);
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            if (!lines[i].isBlank()) sb.append(pad).append(lines[i]);
        }
        return sb.toString();
    }

    public static final class Builder {
        private final List<Node> children = new ArrayList<>();
        private final int indentLevel;

        private Builder(int indentLevel) {
            this.indentLevel = indentLevel;
        }

        public Builder add(Node node) {
            children.add(node);
            return this;
        }

        public Body build() {
            return new Body(children, indentLevel);
        }
    }
}
