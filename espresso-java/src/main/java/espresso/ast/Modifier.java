package espresso.ast;

import espresso.lexer.TokenType;

import java.util.List;

public enum Modifier {
    PUBLIC("public"),
    PRIVATE("private"),
    PROTECTED("protected"),
    CONST("const"),
    CONSTEXPR("constexpr"),
    STATIC("static"),
    ABSTRACT("abstract"),
    OVERRIDE("override"),
    VIRTUAL("virtual");

    private final String keyword;

    Modifier(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() { return keyword; }

    public boolean isAccess() {
        return this == PUBLIC || this == PRIVATE || this == PROTECTED;
    }

    public static Modifier fromToken(TokenType type) {
        return switch (type) {
            case PUBLIC -> PUBLIC;
            case PRIVATE -> PRIVATE;
            case PROTECTED -> PROTECTED;
            case CONST -> CONST;
            case CONSTEXPR -> CONSTEXPR;
            case STATIC -> STATIC;
            case ABSTRACT -> ABSTRACT;
            case OVERRIDE -> OVERRIDE;
            case VIRTUAL -> VIRTUAL;
            default -> throw new IllegalArgumentException("Not a modifier token: " + type);
        };
    }

    /**
     * Declaration prefix with a trailing space, or "" for none. With {@code accessLabels} the access
     * modifiers become an inline label ({@code public: }), otherwise they are dropped;
     * {@code abstract} becomes a comment.
     */
    public static String prefix(List<Modifier> modifiers, boolean accessLabels) {
        StringBuilder sb = new StringBuilder();
        for (Modifier m : modifiers) {
            if (accessLabels && m.isAccess()) sb.append(m.keyword).append(": ");
        }
        for (Modifier m : modifiers) {
            if (m.isAccess()) continue;
            if (m == ABSTRACT) sb.append("/* abstract */ ");
            else sb.append(m.keyword).append(' ');
        }
        return sb.toString();
    }
}
