package org.introspect.ir;

/**
 * Non-logical binary operators, with C precedence levels (higher binds tighter).
 */
public enum BinaryOperator {

    MULTIPLY("*", 13, Category.ARITHMETIC),
    DIVIDE("/", 13, Category.ARITHMETIC),
    REMAINDER("%", 13, Category.ARITHMETIC),
    ADD("+", 12, Category.ARITHMETIC),
    SUBTRACT("-", 12, Category.ARITHMETIC),
    SHIFT_LEFT("<<", 11, Category.ARITHMETIC),
    SHIFT_RIGHT(">>", 11, Category.ARITHMETIC),
    LESS("<", 10, Category.COMPARISON),
    LESS_EQUALS("<=", 10, Category.COMPARISON),
    GREATER(">", 10, Category.COMPARISON),
    GREATER_EQUALS(">=", 10, Category.COMPARISON),
    EQUALS("==", 9, Category.COMPARISON),
    NOT_EQUALS("!=", 9, Category.COMPARISON),
    BIT_AND("&", 8, Category.ARITHMETIC),
    BIT_XOR("^", 7, Category.ARITHMETIC),
    BIT_OR("|", 6, Category.ARITHMETIC);

    public enum Category {
        ARITHMETIC,
        COMPARISON
    }

    private final String symbol;
    private final int precedence;
    private final Category category;

    BinaryOperator(String symbol, int precedence, Category category) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.category = category;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isComparison() {
        return category == Category.COMPARISON;
    }
}
