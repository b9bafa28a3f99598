package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

/**
 * A classified condition node. The hierarchy is closed; consumers dispatch through
 * {@link NodeVisitor}, so every kind is handled or falls to an explicit default.
 * <p>
 * Each node carries an id that is unique within its tree and assigned in
 * pre-order by {@link ExpressionClassifier}. Ids index the slot and record tables
 * built by the recorder.
 */
public abstract sealed class ExpressionNode
        permits Variable, Constant, StringLiteral, NullPointer, Cast, UnaryOp, BinaryOp,
                LogicalAnd, LogicalOr, Call, Unsupported {

    private final int id;
    private final CType type;

    protected ExpressionNode(int id, CType type) {
        this.id = id;
        this.type = type;
    }

    public int getId() {
        return id;
    }

    public CType getType() {
        return type;
    }

    public abstract NodeKind getKind();

    public abstract List<ExpressionNode> getChildren();

    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * Whether the node's value is captured in a slot of its own when it is reached.
     */
    public boolean isLeaf() {
        return false;
    }

    /**
     * Leaves whose text already spells their value.
     */
    public boolean isLiteral() {
        return false;
    }

    /**
     * Number of nodes in the subtree rooted here.
     */
    public int size() {
        int size = 1;
        for (ExpressionNode child : getChildren()) {
            size += child.size();
        }
        return size;
    }
}
