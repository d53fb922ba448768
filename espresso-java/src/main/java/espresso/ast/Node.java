package espresso.ast;

/**
 * Every syntax tree node renders itself as C++.
 */
public interface Node {

    NodeKind kind();

    String render(RenderContext ctx);

    /** Expressions and literals; a {@link Body} terminates these with {@code ;}. */
    default boolean isValueProducing() {
        return kind().family().valueProducing();
    }

    default String render() {
        return render(new RenderContext());
    }
}
