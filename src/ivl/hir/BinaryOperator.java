package ivl.hir;

/** Binary operators with their printed symbol and binding strength. */
public enum BinaryOperator {
    IFF("<==>", 1),
    IMPLIES("==>", 2),
    OR("||", 3),
    AND("&&", 4),
    EQ("==", 5),
    NEQ("!=", 5),
    LT("<", 5),
    LE("<=", 5),
    GT(">", 5),
    GE(">=", 5),
    CONCAT("++", 6),
    ADD("+", 7),
    SUB("-", 7),
    MUL("*", 8),
    DIV("div", 8),
    MOD("mod", 8);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == IMPLIES;
    }

    public boolean isRelational() {
        return precedence == 5;
    }

    public boolean isBoolean() {
        return precedence <= 4;
    }

    /** Returns the operator whose symbol is s. */
    public static BinaryOperator fromSymbol(String s) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(s)) {
                return op;
            }
        }
        throw new IllegalArgumentException("unknown binary operator " + s);
    }
}
