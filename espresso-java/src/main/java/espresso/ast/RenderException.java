package espresso.ast;

import espresso.TranspileException;

public class RenderException extends TranspileException {

    private final NodeKind kind;

    public RenderException(NodeKind kind, String message) {
        super(kind + ": " + message, 0, 0);
        this.kind = kind;
    }

    public NodeKind kind() { return kind; }
}
