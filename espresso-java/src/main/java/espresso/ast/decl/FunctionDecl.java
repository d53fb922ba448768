package espresso.ast.decl;

import espresso.ast.Body;
import espresso.ast.Modifier;
import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.types.TypeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Function, method or constructor.
 * <p>
 * C++ has no keyword arguments, so a function with parameters is emitted twice: the plain
 * positional version, then a {@code <name>_Params} struct with one {@code _field} per parameter
 * and an overload taking that struct which unpacks the fields and runs the same body.
 *
 * @param returnType null for constructors
 * @param trailing   modifiers written after the parameter list ({@code const}, {@code override})
 * @param body       null for a bodiless declaration; with {@code abstract} it becomes pure virtual
 */
public record FunctionDecl(
        List<Modifier> modifiers,
        String returnType,
        String name,
        List<GenericParam> generics,
        List<Param> params,
        List<Modifier> trailing,
        Body body
) implements Decl {

    public FunctionDecl {
        modifiers = modifiers == null ? new ArrayList<>() : List.copyOf(modifiers);
        generics = generics == null ? new ArrayList<>() : List.copyOf(generics);
        params = params == null ? new ArrayList<>() : List.copyOf(params);
        trailing = trailing == null ? new ArrayList<>() : List.copyOf(trailing);
        String dup = GenericParam.firstDuplicate(generics);
        if (dup != null) throw new IllegalArgumentException("Duplicate generic parameter '" + dup + "'");
    }

    public FunctionDecl(String returnType, String name, List<Param> params, Body body) {
        this(null, returnType, name, null, params, null, body);
    }

    public String paramsStructName() {
        return name + "_Params";
    }

    public boolean isAbstract() {
        return modifiers.contains(Modifier.ABSTRACT) && body == null;
    }

    @Override
    public NodeKind kind() { return NodeKind.FUNCTION; }

    @Override
    public String render(RenderContext ctx) {
        String positional = renderPositional(ctx);
        if (params.isEmpty() || body == null) return positional;
        return positional + "\n\n" + renderNamed(ctx);
    }

    private String renderPositional(RenderContext ctx) {
        String paramList = params.stream().map(p -> p.render(ctx)).collect(Collectors.joining(", "));
        String signature = head(ctx) + "(" + paramList + ")" + trailingText(true);

        if (isAbstract()) return GenericParam.preamble(generics, ctx) + signature + " = 0;";
        if (body == null) return GenericParam.preamble(generics, ctx) + signature + ";";
        return GenericParam.preamble(generics, ctx) + signature + " " + body.renderBlock(ctx);
    }

    private String renderNamed(RenderContext ctx) {
        String structName = paramsStructName();
        String structType = generics.isEmpty() ? structName : structName + GenericParam.arguments(generics);

        StringBuilder sb = new StringBuilder();
        sb.append(GenericParam.preamble(generics, ctx));
        sb.append("struct ").append(structName).append(" {\n");
        for (Param p : params) {
            sb.append(Body.INDENT).append(p.cppType()).append(" _").append(p.name());
            if (p.defaultValue() != null) sb.append(" = ").append(p.defaultValue().render(ctx));
            sb.append(";\n");
        }
        sb.append("};\n");

        sb.append(GenericParam.preamble(generics, ctx));
        String arg = structArgumentName();
        sb.append(head(ctx)).append('(').append(structType).append(' ').append(arg).append(')')
                .append(trailingText(false));
        sb.append(" {\n");
        for (Param p : params) {
            sb.append(Body.INDENT).append(p.cppType()).append(' ').append(p.name())
                    .append(" = ").append(arg).append("._").append(p.name()).append(";\n");
        }
        String inner = body.render(ctx);
        if (!inner.isEmpty()) sb.append(inner).append('\n');
        sb.append('}');
        return sb.toString();
    }

    /** {@code params}, or with leading underscores while a parameter already has that name. */
    private String structArgumentName() {
        Set<String> names = params.stream().map(Param::name).collect(Collectors.toSet());
        String arg = "params";
        while (names.contains(arg)) arg = "_" + arg;
        return arg;
    }

    /** Prefix modifiers, return type and name. */
    private String head(RenderContext ctx) {
        List<Modifier> prefix = new ArrayList<>();
        for (Modifier m : modifiers) {
            if (m == Modifier.OVERRIDE) continue;
            Modifier effective = m == Modifier.ABSTRACT ? Modifier.VIRTUAL : m;
            if (!prefix.contains(effective)) prefix.add(effective);
        }
        String ret = returnType == null ? "" : TypeMapper.convert(returnType) + " ";
        return Modifier.prefix(prefix, ctx.inClass()) + ret + name;
    }

    private String trailingText(boolean withOverride) {
        List<Modifier> after = new ArrayList<>(trailing);
        if (modifiers.contains(Modifier.OVERRIDE) && !after.contains(Modifier.OVERRIDE)) after.add(Modifier.OVERRIDE);
        StringBuilder sb = new StringBuilder();
        for (Modifier m : after) {
            if (m == Modifier.OVERRIDE && !withOverride) continue;
            sb.append(' ').append(m.keyword());
        }
        return sb.toString();
    }
}
