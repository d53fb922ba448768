package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

public record MemberAccessExpr(Expr target, String member) implements Expr {

    @Override
    public NodeKind kind() { return NodeKind.MEMBER_ACCESS; }

    @Override
    public String render(RenderContext ctx) {
        if (target instanceof Identifier id && id.name().equals("this")) {
            return "this->" + member;
        }
        return target.render(ctx) + "." + member;
    }
}
