package espresso.ast;

import java.util.List;

/**
 * Root of a parsed unit. Rendering collects the includes the body asks for, then prints them
 * sorted above the code.
 */
public record Program(Body body, List<String> defaultIncludes) {

    public static final List<String> DEFAULT_INCLUDES = List.of("<runtime.hpp>");

    public Program {
        defaultIncludes = List.copyOf(defaultIncludes);
    }

    public Program(Body body) {
        this(body, DEFAULT_INCLUDES);
    }

    public Program withDefaultIncludes(List<String> includes) {
        return new Program(body, includes);
    }

    public String render() {
        RenderContext ctx = new RenderContext(defaultIncludes);
        String code = body.render(ctx);

        StringBuilder sb = new StringBuilder();
        for (String include : ctx.includes()) {
            sb.append("#include ").append(include).append('\n');
        }
        if (sb.length() > 0) sb.append('\n');
        sb.append(code);
        if (!code.isEmpty()) sb.append('\n');
        return sb.toString();
    }
}
