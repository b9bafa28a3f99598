package org.introspect.host;

/**
 * Node codes of the host's typed expression tree.
 */
public enum TreeCode {

    VARIABLE(null),
    INTEGER_CONSTANT(null),
    STRING_CONSTANT(null),
    CONVERT(null),

    NEGATE("-"),
    BIT_NOT("~"),
    TRUTH_NOT("!"),
    ADDRESS_OF("&"),

    PLUS("+"),
    MINUS("-"),
    MULT("*"),
    TRUNC_DIV("/"),
    TRUNC_MOD("%"),
    BIT_AND("&"),
    BIT_IOR("|"),
    BIT_XOR("^"),
    LSHIFT("<<"),
    RSHIFT(">>"),

    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),

    TRUTH_ANDIF("&&"),
    TRUTH_ORIF("||"),

    CALL(null),

    COMPONENT_REF(null),
    ARRAY_REF(null),
    INDIRECT_REF(null),
    OTHER(null),

    ERROR_MARK(null);

    private final String symbol;

    TreeCode(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isUnary() {
        return this == NEGATE || this == BIT_NOT || this == TRUTH_NOT || this == ADDRESS_OF;
    }

    public boolean isBinary() {
        return symbol != null && !isUnary();
    }
}
