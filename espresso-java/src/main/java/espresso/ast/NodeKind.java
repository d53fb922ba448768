package espresso.ast;

public enum NodeKind {

    // literals
    NUMERIC_LITERAL(Family.LITERAL),
    STRING_LITERAL(Family.LITERAL),
    RAW_STRING_LITERAL(Family.LITERAL),
    INTERPOLATED_STRING(Family.LITERAL),
    CHAR_LITERAL(Family.LITERAL),
    BOOL_LITERAL(Family.LITERAL),
    NULL_LITERAL(Family.LITERAL),
    VOID_LITERAL(Family.LITERAL),
    CONTAINER_LITERAL(Family.LITERAL),
    MAP_LITERAL(Family.LITERAL),

    // expressions
    IDENTIFIER(Family.EXPRESSION),
    ARITHMETIC(Family.EXPRESSION),
    BITWISE(Family.EXPRESSION),
    UNARY(Family.EXPRESSION),
    COMPARISON(Family.EXPRESSION),
    LOGICAL(Family.EXPRESSION),
    TERNARY(Family.EXPRESSION),
    GROUPING(Family.EXPRESSION),
    CALL(Family.EXPRESSION),
    MEMBER_ACCESS(Family.EXPRESSION),
    INDEX(Family.EXPRESSION),
    ASSIGNMENT(Family.EXPRESSION),
    LAMBDA(Family.EXPRESSION),

    // declarations
    VAR_DECLARE(Family.DECLARATION),
    VAR_ASSIGN(Family.DECLARATION),
    MULTI_VAR_DECLARE(Family.DECLARATION),
    MULTI_VAR_ASSIGN(Family.DECLARATION),
    FUNCTION(Family.DECLARATION),
    CLASS(Family.DECLARATION),
    CLASS_SECTION(Family.DECLARATION),
    GENERIC_PARAM(Family.DECLARATION),
    PARAM(Family.DECLARATION),

    // control flow
    IF(Family.CONTROL_FLOW),
    WHILE(Family.CONTROL_FLOW),
    FOR_IN(Family.CONTROL_FLOW),
    FOR(Family.CONTROL_FLOW),
    MATCH(Family.CONTROL_FLOW),
    TRY(Family.CONTROL_FLOW),
    BREAK(Family.CONTROL_FLOW),
    CONTINUE(Family.CONTROL_FLOW),
    RETURN(Family.CONTROL_FLOW),
    THROW(Family.CONTROL_FLOW),
    FOREIGN_BLOCK(Family.CONTROL_FLOW),

    // annotations
    DEFINE(Family.ANNOTATION),
    ASSERT(Family.ANNOTATION),
    NAMESPACE(Family.ANNOTATION),
    INCLUDE(Family.ANNOTATION),
    USING(Family.ANNOTATION),
    ALIAS(Family.ANNOTATION),
    PANIC(Family.ANNOTATION),
    MARKER(Family.ANNOTATION);

    public enum Family {
        LITERAL(true),
        EXPRESSION(true),
        DECLARATION(false),
        CONTROL_FLOW(false),
        ANNOTATION(false);

        private final boolean valueProducing;

        Family(boolean valueProducing) {
            this.valueProducing = valueProducing;
        }

        public boolean valueProducing() { return valueProducing; }
    }

    private final Family family;

    NodeKind(Family family) {
        this.family = family;
    }

    public Family family() { return family; }
}
