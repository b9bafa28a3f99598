package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

/**
 * A shape the classifier does not model. Its value is still computed, opaquely,
 * when an enclosing operator needs it, but it is never expanded.
 */
public final class Unsupported extends ExpressionNode {

    private final String originalText;

    public Unsupported(int id, String originalText, CType type) {
        super(id, type);
        this.originalText = originalText;
    }

    public String getOriginalText() {
        return originalText;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNSUPPORTED;
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
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
