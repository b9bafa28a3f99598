package org.introspect.ir;

public enum NodeKind {
    VARIABLE,
    CONSTANT,
    STRING_LITERAL,
    NULL_POINTER,
    CAST,
    UNARY,
    BINARY,
    LOGICAL_AND,
    LOGICAL_OR,
    CALL,
    UNSUPPORTED
}
