package espresso.ast;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * State of one rendering pass. Nodes register the headers their C++ needs here.
 */
public final class RenderContext {

    private final SortedSet<String> includes = new TreeSet<>();
    private int classDepth;

    public RenderContext() {}

    public RenderContext(Collection<String> initialIncludes) {
        initialIncludes.forEach(this::include);
    }

    /** Registers {@code <header>} or {@code "header"}; a bare name gets angle brackets. */
    public void include(String header) {
        String h = header.strip();
        if (h.isEmpty()) return;
        if (!h.startsWith("<") && !h.startsWith("\"")) h = "<" + h + ">";
        includes.add(h);
    }

    /** Members rendered until the matching {@link #exitClass()} sit inside a class body. */
    public void enterClass() {
        classDepth++;
    }

    public void exitClass() {
        if (classDepth == 0) throw new IllegalStateException("exitClass without enterClass");
        classDepth--;
    }

    /** True while the members of a class are being rendered. */
    public boolean inClass() {
        return classDepth > 0;
    }

    public SortedSet<String> includes() {
        return Collections.unmodifiableSortedSet(includes);
    }
}
