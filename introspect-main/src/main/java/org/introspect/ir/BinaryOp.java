package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

public final class BinaryOp extends ExpressionNode {

    private final BinaryOperator operator;
    private final ExpressionNode left;
    private final ExpressionNode right;
    private final CType operationType;

    /**
     * @param operationType the type both operands are converted to before the
     *                      operator applies; for shifts and pointer arithmetic, the
     *                      type of the left operand
     * @param type          the result type
     */
    public BinaryOp(int id, BinaryOperator operator, ExpressionNode left, ExpressionNode right,
                    CType operationType, CType type) {
        super(id, type);
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.operationType = operationType;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public ExpressionNode getRight() {
        return right;
    }

    public CType getOperationType() {
        return operationType;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY;
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
