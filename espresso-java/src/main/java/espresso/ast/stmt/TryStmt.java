package espresso.ast.stmt;

import espresso.ast.Body;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.types.TypeMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * try / catch / finally. C++ has no {@code finally}; it is lowered to
 * <pre>
 * try { try-with-catches } catch (...) { F throw; }
 * F
 * </pre>
 * so F runs on both the normal and the exceptional path.
 */
public record TryStmt(Body body, List<Catch> catches, Body finallyBody) implements Stmt {

    /** {@code type == null} catches everything; {@code name} may be null. */
    public record Catch(String type, String name, Body body) {

        String render(RenderContext ctx) {
            String head;
            if (type == null) head = "catch (...)";
            else if (name == null) head = "catch (const " + TypeMapper.convert(type) + "&)";
            else head = "catch (const " + TypeMapper.convert(type) + "& " + name + ")";
            return head + " " + body.renderBlock(ctx);
        }
    }

    public TryStmt {
        catches = catches == null ? new ArrayList<>() : List.copyOf(catches);
    }

    @Override
    public NodeKind kind() { return NodeKind.TRY; }

    @Override
    public String render(RenderContext ctx) {
        StringBuilder tryCatch = new StringBuilder("try ").append(body.renderBlock(ctx));
        for (Catch c : catches) tryCatch.append(' ').append(c.render(ctx));

        if (finallyBody == null) {
            // C++ wants at least one handler
            if (catches.isEmpty()) tryCatch.append(" catch (...) {\n").append(Body.INDENT).append("throw;\n}");
            return tryCatch.toString();
        }

        String guarded = catches.isEmpty()
                ? body.renderBlock(ctx)
                : "{\n" + Body.indent(tryCatch.toString(), 1) + "\n}";

        StringBuilder sb = new StringBuilder("try ").append(guarded).append(" catch (...) {\n");
        String cleanup = finallyBody.render(ctx);
        if (!cleanup.isEmpty()) sb.append(cleanup).append('\n');
        sb.append(Body.INDENT).append("throw;\n}");

        String after = new Body(finallyBody.children(), 0).render(ctx);
        if (!after.isEmpty()) sb.append('\n').append(after);
        return sb.toString();
    }
}
