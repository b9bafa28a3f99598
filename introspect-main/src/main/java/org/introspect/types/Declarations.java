package org.introspect.types;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Names visible to an assertion condition: variables, function prototypes,
 * typedefs, and the static types of expressions the front end keeps opaque
 * (member access, subscripts).
 */
public final class Declarations {

    private final Map<String, CType> variables;
    private final Map<String, FunctionSignature> functions;
    private final Map<String, CType> typedefs;
    private final Map<String, CType> opaqueExpressions;

    private Declarations(Builder builder) {
        this.variables = Map.copyOf(builder.variables);
        this.functions = Map.copyOf(builder.functions);
        this.typedefs = Map.copyOf(builder.typedefs);
        this.opaqueExpressions = Map.copyOf(builder.opaqueExpressions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Declarations empty() {
        return builder().build();
    }

    public Optional<CType> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Optional<FunctionSignature> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Optional<CType> opaqueExpression(String sourceText) {
        return Optional.ofNullable(opaqueExpressions.get(sourceText));
    }

    public CType resolveType(String spelling) {
        return CTypes.parse(spelling, typedefs);
    }

    public static final class Builder {

        private final Map<String, CType> variables = new HashMap<>();
        private final Map<String, FunctionSignature> functions = new HashMap<>();
        private final Map<String, CType> typedefs = new HashMap<>();
        private final Map<String, CType> opaqueExpressions = new HashMap<>();

        private Builder() {}

        public Builder variable(String name, String typeSpelling) {
            return variable(name, CTypes.parse(typeSpelling, typedefs));
        }

        public Builder variable(String name, CType type) {
            variables.put(name, type);
            return this;
        }

        public Builder function(String name, String returnType, String... parameterTypes) {
            return function(name, false, returnType, parameterTypes);
        }

        public Builder variadicFunction(String name, String returnType, String... parameterTypes) {
            return function(name, true, returnType, parameterTypes);
        }

        private Builder function(String name, boolean variadic, String returnType, String... parameterTypes) {
            List<CType> params = Arrays.stream(parameterTypes)
                    .map(p -> CTypes.parse(p, typedefs))
                    .collect(Collectors.toList());
            functions.put(name, new FunctionSignature(name, CTypes.parse(returnType, typedefs), params, variadic));
            return this;
        }

        public Builder typedef(String name, String typeSpelling) {
            typedefs.put(name, CTypes.parse(typeSpelling, typedefs));
            return this;
        }

        /**
         * Declares the static type of an expression the front end does not model,
         * keyed by its exact source text.
         */
        public Builder opaque(String sourceText, String typeSpelling) {
            opaqueExpressions.put(sourceText, CTypes.parse(typeSpelling, typedefs));
            return this;
        }

        public Declarations build() {
            return new Declarations(this);
        }
    }
}
