package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

public final class Constant extends ExpressionNode {

    private final String literalText;
    private final long value;

    public Constant(int id, String literalText, long value, CType type) {
        super(id, type);
        this.literalText = literalText;
        this.value = value;
    }

    public String getLiteralText() {
        return literalText;
    }

    public long getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return List.of();
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
