package espresso.ast.decl;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.types.TypeMapper;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Template parameter. {@code type == null} means a type parameter ({@code typename T}),
 * otherwise a value parameter such as {@code int N}. {@code defaultValue} is source text or null.
 */
public record GenericParam(String type, String name, String defaultValue) implements Decl {

    public static GenericParam typeParam(String name) {
        return new GenericParam(null, name, null);
    }

    public boolean isTypeParam() {
        return type == null;
    }

    @Override
    public NodeKind kind() { return NodeKind.GENERIC_PARAM; }

    @Override
    public String render(RenderContext ctx) {
        if (isTypeParam()) {
            String text = "typename " + name;
            return defaultValue == null ? text : text + " = " + TypeMapper.convert(defaultValue);
        }
        String text = TypeMapper.convert(type) + " " + name;
        return defaultValue == null ? text : text + " = " + defaultValue;
    }

    /** {@code template<typename T, int N>} line, or "" when there are no parameters. */
    public static String preamble(List<GenericParam> generics, RenderContext ctx) {
        if (generics.isEmpty()) return "";
        return generics.stream()
                .map(g -> g.render(ctx))
                .collect(Collectors.joining(", ", "template<", ">\n"));
    }

    /** Name of the first parameter declared twice, or null. */
    public static String firstDuplicate(List<GenericParam> generics) {
        Set<String> seen = new HashSet<>();
        for (GenericParam g : generics) {
            if (!seen.add(g.name())) return g.name();
        }
        return null;
    }

    /** {@code <T, N>} argument list matching the parameters. */
    public static String arguments(List<GenericParam> generics) {
        return generics.stream().map(GenericParam::name).collect(Collectors.joining(", ", "<", ">"));
    }
}
