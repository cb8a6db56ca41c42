package net.vcc.graph;

/**
 * Kind of operator joining the operands of an OperatorExpression.
 */
public enum OperatorType {
    // The + binary operator
    PLUS("plus", "+");

    private final String displayName;
    private final String symbol;

    private OperatorType(String displayName, String symbol) {
        this.displayName = displayName;
        this.symbol = symbol;
    }

    public String toString() {
        return displayName;
    }

    /**
     * The operator as written in source (and C) code.
     */
    public String getSymbol() {
        return symbol;
    }

}
