package org.introspect.ir;

/**
 * A visitor where every kind falls back to {@link #defaultAction(ExpressionNode)}.
 */
public abstract class NodeVisitorWithDefaults<R> implements NodeVisitor<R> {

    public abstract R defaultAction(ExpressionNode n);

    @Override
    public R visit(Variable n) {
        return defaultAction(n);
    }

    @Override
    public R visit(Constant n) {
        return defaultAction(n);
    }

    @Override
    public R visit(StringLiteral n) {
        return defaultAction(n);
    }

    @Override
    public R visit(NullPointer n) {
        return defaultAction(n);
    }

    @Override
    public R visit(Cast n) {
        return defaultAction(n);
    }

    @Override
    public R visit(UnaryOp n) {
        return defaultAction(n);
    }

    @Override
    public R visit(BinaryOp n) {
        return defaultAction(n);
    }

    @Override
    public R visit(LogicalAnd n) {
        return defaultAction(n);
    }

    @Override
    public R visit(LogicalOr n) {
        return defaultAction(n);
    }

    @Override
    public R visit(Call n) {
        return defaultAction(n);
    }

    @Override
    public R visit(Unsupported n) {
        return defaultAction(n);
    }
}
