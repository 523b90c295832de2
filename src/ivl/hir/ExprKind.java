package ivl.hir;

/** Closed set of expression forms; rewriters dispatch on it. */
public enum ExprKind {
    IDENTIFIER,
    LITERAL,
    UNARY,
    BINARY,
    FUNCTION_CALL,
    MAP_SELECT,
    MAP_STORE,
    IF_THEN_ELSE,
    OLD,
    BV_EXTRACT
}
