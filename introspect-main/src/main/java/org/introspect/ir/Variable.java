package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

public final class Variable extends ExpressionNode {

    private final String name;

    public Variable(int id, String name, CType type) {
        super(id, type);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE;
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
