package espresso.ast.annotation;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;

/** {@code @io}, {@code @safe}, {@code @unsafe}: kept as a comment line for readers of the output. */
public record MarkerAnnotation(Marker marker) implements Annotation {

    public enum Marker {
        IO("// IO:"),
        SAFE("// SAFE:"),
        UNSAFE("// UNSAFE:");

        private final String comment;

        Marker(String comment) {
            this.comment = comment;
        }

        public String comment() { return comment; }
    }

    @Override
    public NodeKind kind() { return NodeKind.MARKER; }

    @Override
    public String render(RenderContext ctx) {
        return marker.comment();
    }
}
