package org.introspect.ir;

import org.introspect.types.CType;

import java.util.List;

public final class Call extends ExpressionNode {

    private final String callee;
    private final List<ExpressionNode> arguments;
    private final List<CType> parameterTypes;

    /**
     * @param parameterTypes the type each argument is converted to before the call
     */
    public Call(int id, String callee, List<ExpressionNode> arguments, List<CType> parameterTypes, CType returnType) {
        super(id, returnType);
        if (arguments.size() != parameterTypes.size()) {
            throw new IllegalArgumentException("Expected one parameter type per argument of " + callee);
        }
        this.callee = callee;
        this.arguments = List.copyOf(arguments);
        this.parameterTypes = List.copyOf(parameterTypes);
    }

    public String getCallee() {
        return callee;
    }

    public List<ExpressionNode> getArguments() {
        return arguments;
    }

    public List<CType> getParameterTypes() {
        return parameterTypes;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CALL;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return arguments;
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
