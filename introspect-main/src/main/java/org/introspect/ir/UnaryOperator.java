package org.introspect.ir;

public enum UnaryOperator {

    NEGATE("-"),
    BIT_NOT("~"),
    LOGICAL_NOT("!"),
    ADDRESS_OF("&");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
