package ivl.hir;

public enum UnaryOperator {
    NOT("!"),
    NEG("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
