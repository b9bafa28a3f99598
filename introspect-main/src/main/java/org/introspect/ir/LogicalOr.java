package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

public final class LogicalOr extends ExpressionNode {

    private final ExpressionNode left;
    private final ExpressionNode right;

    public LogicalOr(int id, ExpressionNode left, ExpressionNode right) {
        super(id, CType.INT);
        this.left = left;
        this.right = right;
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public ExpressionNode getRight() {
        return right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LOGICAL_OR;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
