package espresso.ast.decl;

import espresso.ast.Body;
import espresso.ast.Modifier;
import espresso.ast.Node;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.types.TypeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Class with optional template parameters and public bases. Members before the first divider
 * render one level in; {@link ClassSection} labels render at the class's own column.
 */
public record ClassDecl(
        List<Modifier> modifiers,
        String name,
        List<GenericParam> generics,
        List<String> bases,
        Body body
) implements Decl {

    public ClassDecl {
        modifiers = modifiers == null ? new ArrayList<>() : List.copyOf(modifiers);
        generics = generics == null ? new ArrayList<>() : List.copyOf(generics);
        bases = bases == null ? new ArrayList<>() : List.copyOf(bases);
        String dup = GenericParam.firstDuplicate(generics);
        if (dup != null) throw new IllegalArgumentException("Duplicate generic parameter '" + dup + "'");
    }

    public ClassDecl(String name, Body body) {
        this(null, name, null, null, body);
    }

    @Override
    public NodeKind kind() { return NodeKind.CLASS; }

    @Override
    public String render(RenderContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(GenericParam.preamble(generics, ctx));
        sb.append(Modifier.prefix(modifiers, false)).append("class ").append(name);
        if (!bases.isEmpty()) {
            sb.append(bases.stream()
                    .map(b -> "public " + TypeMapper.convert(b))
                    .collect(Collectors.joining(", ", " : ", "")));
        }
        sb.append(" {\n");

        ctx.enterClass();
        try {
            for (Node member : body.children()) {
                String text;
                if (member instanceof ClassSection section) {
                    text = section.render(ctx);
                } else {
                    text = Body.indent(Body.renderStatement(member, ctx), body.indentLevel());
                }
                if (!text.isEmpty()) sb.append(text).append('\n');
            }
        } finally {
            ctx.exitClass();
        }
        sb.append("};");
        return sb.toString();
    }
}
