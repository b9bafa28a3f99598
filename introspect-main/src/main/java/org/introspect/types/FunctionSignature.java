package org.introspect.types;

import java.util.List;

/**
 * Prototype of a function callable from an assertion condition. Arguments past
 * the declared parameters of a variadic function get the default promotions.
 */
public record FunctionSignature(String name, CType returnType, List<CType> parameterTypes, boolean variadic) {

    public FunctionSignature {
        parameterTypes = List.copyOf(parameterTypes);
    }

    public boolean accepts(int argumentCount) {
        return variadic ? argumentCount >= parameterTypes.size() : argumentCount == parameterTypes.size();
    }
}
