package org.introspect.runtime;

import org.introspect.ExpressionEvaluationException;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * In-memory program state: named variables, host functions, opaque expression
 * values and a bump-allocated data segment for strings.
 * <p>
 * Not thread-safe; one instance models one thread's view of the program.
 */
public class SimulatedEnvironment implements RuntimeEnvironment {

    private static final long DATA_SEGMENT_BASE = 0x555555554000L;
    private static final long STACK_BASE = 0x7ffd3b6e0000L;
    private static final int ALIGNMENT = 16;

    private final Map<String, Object> variables = new HashMap<>();
    private final Map<String, HostFunction> functions = new HashMap<>();
    private final Map<String, Supplier<Object>> opaqueValues = new HashMap<>();
    private final Map<String, Pointer> literals = new HashMap<>();
    private final Map<String, Long> stackAddresses = new LinkedHashMap<>();

    private long nextDataAddress = DATA_SEGMENT_BASE;

    public SimulatedEnvironment set(String name, long value) {
        variables.put(name, value);
        return this;
    }

    public SimulatedEnvironment set(String name, Object value) {
        variables.put(name, value);
        return this;
    }

    /**
     * Binds {@code name} to a freshly allocated NUL-terminated copy of {@code text}.
     */
    public SimulatedEnvironment setString(String name, String text) {
        variables.put(name, allocateString(text));
        return this;
    }

    public SimulatedEnvironment setNull(String name) {
        variables.put(name, Pointer.NULL);
        return this;
    }

    public SimulatedEnvironment define(String function, HostFunction implementation) {
        functions.put(function, implementation);
        return this;
    }

    public SimulatedEnvironment opaque(String sourceText, Object value) {
        opaqueValues.put(sourceText, () -> value);
        return this;
    }

    public SimulatedEnvironment opaque(String sourceText, Supplier<Object> value) {
        opaqueValues.put(sourceText, value);
        return this;
    }

    public Pointer allocateString(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        byte[] storage = new byte[bytes.length + 1];
        System.arraycopy(bytes, 0, storage, 0, bytes.length);
        return allocate(storage);
    }

    public Pointer allocate(byte[] storage) {
        long address = nextDataAddress;
        nextDataAddress += align(Math.max(storage.length, 1));
        return Pointer.to(address, storage);
    }

    @Override
    public Object read(String variable) {
        if (!variables.containsKey(variable)) {
            throw new ExpressionEvaluationException("Variable '" + variable + "' is not bound");
        }
        return variables.get(variable);
    }

    @Override
    public Pointer addressOf(String variable) {
        if (!variables.containsKey(variable)) {
            throw new ExpressionEvaluationException("Variable '" + variable + "' is not bound");
        }
        long address = stackAddresses.computeIfAbsent(variable,
                v -> STACK_BASE - (long) (stackAddresses.size() + 1) * ALIGNMENT);
        return Pointer.ofAddress(address);
    }

    @Override
    public Pointer stringLiteral(String value) {
        return literals.computeIfAbsent(value, this::allocateString);
    }

    @Override
    public Object call(String function, List<Object> arguments) {
        HostFunction implementation = functions.get(function);
        if (implementation == null) {
            throw new ExpressionEvaluationException("Function '" + function + "' is not defined");
        }
        return implementation.invoke(arguments);
    }

    @Override
    public Object evaluateOpaque(String sourceText) {
        Supplier<Object> value = opaqueValues.get(sourceText);
        if (value == null) {
            throw new ExpressionEvaluationException("No value for opaque expression '" + sourceText + "'");
        }
        return value.get();
    }

    private static long align(long size) {
        return (size + ALIGNMENT - 1) / ALIGNMENT * ALIGNMENT;
    }
}
