package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

public final class UnaryOp extends ExpressionNode {

    private final UnaryOperator operator;
    private final ExpressionNode operand;

    public UnaryOp(int id, UnaryOperator operator, ExpressionNode operand, CType type) {
        super(id, type);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public ExpressionNode getOperand() {
        return operand;
    }

    public boolean isAddressOf() {
        return operator == UnaryOperator.ADDRESS_OF;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public boolean isLeaf() {
        return isAddressOf();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
