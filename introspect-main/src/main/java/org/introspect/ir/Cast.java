package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

/**
 * A conversion to {@link #getType()}. Promotions are conversions the compiler
 * inserted; they are rendered like explicit casts. Casts may nest.
 */
public final class Cast extends ExpressionNode {

    private final ExpressionNode inner;
    private final boolean promotion;

    public Cast(int id, ExpressionNode inner, CType target, boolean promotion) {
        super(id, target);
        this.inner = inner;
        this.promotion = promotion;
    }

    public ExpressionNode getInner() {
        return inner;
    }

    public boolean isPromotion() {
        return promotion;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CAST;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return List.of(inner);
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
