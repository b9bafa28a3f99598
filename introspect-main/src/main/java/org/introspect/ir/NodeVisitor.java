package org.introspect.ir;

public interface NodeVisitor<R> {

    R visit(Variable n);

    R visit(Constant n);

    R visit(StringLiteral n);

    R visit(NullPointer n);

    R visit(Cast n);

    R visit(UnaryOp n);

    R visit(BinaryOp n);

    R visit(LogicalAnd n);

    R visit(LogicalOr n);

    R visit(Call n);

    R visit(Unsupported n);
}
