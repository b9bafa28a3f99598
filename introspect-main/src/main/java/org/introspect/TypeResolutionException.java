package org.introspect;

public class TypeResolutionException extends IntrospectException {

    private final String typeName;

    public TypeResolutionException(String typeName) {
        super("Unable to resolve type '" + typeName + "'");
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
