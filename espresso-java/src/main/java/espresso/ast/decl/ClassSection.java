package espresso.ast.decl;

import espresso.ast.Body;
import espresso.ast.Modifier;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

/** {@code public:} divider and the members that follow it. */
public record ClassSection(Modifier access, Body body) implements Decl {

    public ClassSection {
        if (!access.isAccess()) {
            throw new IllegalArgumentException("not an access modifier: " + access);
        }
    }

    @Override
    public NodeKind kind() { return NodeKind.CLASS_SECTION; }

    /** Label at column 0, members one level in. */
    @Override
    public String render(RenderContext ctx) {
        String members = body.render(ctx);
        return members.isEmpty() ? access.keyword() + ":" : access.keyword() + ":\n" + members;
    }
}
