package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

public final class NullPointer extends ExpressionNode {

    private final String spelling;

    public NullPointer(int id, String spelling, CType type) {
        super(id, type);
        this.spelling = spelling;
    }

    /**
     * How the constant was written, usually {@code NULL}.
     */
    public String getSpelling() {
        return spelling;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NULL_POINTER;
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
