package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

public final class StringLiteral extends ExpressionNode {

    private final String text;
    private final String value;

    /**
     * @param text  the literal as written, quotes included
     * @param value the characters it denotes
     */
    public StringLiteral(int id, String text, String value) {
        super(id, CType.CHAR_POINTER);
        this.text = text;
        this.value = value;
    }

    public String getText() {
        return text;
    }

    public String getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STRING_LITERAL;
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
