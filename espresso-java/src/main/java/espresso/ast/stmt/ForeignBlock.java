package espresso.ast.stmt;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Embedded C++ copied verbatim. Leading and trailing blank lines are dropped and the common
 * indentation of the code lines is removed; comment lines lose at most that much.
 */
public record ForeignBlock(String code) implements Stmt {

    @Override
    public NodeKind kind() { return NodeKind.FOREIGN_BLOCK; }

    @Override
    public String render(RenderContext ctx) {
        return normalize(code);
    }

    static String normalize(String code) {
        List<String> lines = new ArrayList<>(List.of(code.split("\\R", -1)));
        while (!lines.isEmpty() && lines.get(0).isBlank()) lines.remove(0);
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) lines.remove(lines.size() - 1);
        if (lines.isEmpty()) return "";

        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank() || isComment(line)) continue;
            common = Math.min(common, leadingWhitespace(line));
        }
        if (common == Integer.MAX_VALUE) {
            // only comments: strip by their own indentation
            for (String line : lines) {
                if (!line.isBlank()) common = Math.min(common, leadingWhitespace(line));
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) sb.append('\n');
            String line = lines.get(i);
            int cut = Math.min(common, leadingWhitespace(line));
            sb.append(line.substring(cut).stripTrailing());
        }
        return sb.toString();
    }

    private static boolean isComment(String line) {
        String s = line.strip();
        return s.startsWith("//") || s.startsWith("/*") || s.startsWith("*");
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) i++;
        return i;
    }
}
