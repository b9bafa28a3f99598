package org.introspect.runtime;

import org.introspect.ExpressionEvaluationException;
import org.introspect.types.CType;

/**
 * Conversions between host values and the engine's value representation.
 * Integral values are {@link Long}s normalized to the width and signedness of
 * their static type; pointer values are {@link Pointer}s.
 */
public final class Values {

    private Values() {}

    public static long normalize(long raw, CType type) {
        if (type.getKind() == CType.Kind.BOOL) {
            return raw != 0 ? 1L : 0L;
        }
        int bits = type.getBits();
        if (bits >= 64) {
            return raw;
        }
        long mask = (1L << bits) - 1;
        long truncated = raw & mask;
        if (!type.isUnsigned() && (truncated & (1L << (bits - 1))) != 0) {
            truncated |= ~mask;
        }
        return truncated;
    }

    /**
     * Accepts a value supplied by a {@link RuntimeEnvironment} for a node of the given type.
     */
    public static Object coerce(Object value, CType type) {
        if (type.isPointer()) {
            if (value instanceof Pointer) {
                return value;
            }
            if (value == null) {
                return Pointer.NULL;
            }
            if (value instanceof Number) {
                return Pointer.ofAddress(((Number) value).longValue());
            }
            throw new ExpressionEvaluationException(
                    "Expected a pointer for type '" + type + "' but got " + value.getClass().getSimpleName());
        }
        if (type.isIntegral()) {
            if (value instanceof Number) {
                return normalize(((Number) value).longValue(), type);
            }
            if (value instanceof Boolean) {
                return (Boolean) value ? 1L : 0L;
            }
            if (value instanceof Character) {
                return normalize((Character) value, type);
            }
            if (value instanceof Pointer) {
                return normalize(((Pointer) value).getAddress(), type);
            }
            throw new ExpressionEvaluationException(
                    "Expected an integer for type '" + type + "' but got "
                            + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        return value;
    }

    public static Object convert(Object value, CType target) {
        if (target.isPointer()) {
            return value instanceof Pointer ? value : Pointer.ofAddress(asLong(value));
        }
        if (target.isIntegral()) {
            if (target.getKind() == CType.Kind.BOOL) {
                return isTrue(value) ? 1L : 0L;
            }
            return normalize(asLong(value), target);
        }
        return value;
    }

    public static long asLong(Object value) {
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Pointer) {
            return ((Pointer) value).getAddress();
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        throw new ExpressionEvaluationException("Not a scalar value: " + value);
    }

    public static boolean isTrue(Object value) {
        if (value instanceof Pointer) {
            return !((Pointer) value).isNull();
        }
        return asLong(value) != 0L;
    }

    public static int compare(Object left, Object right, boolean unsigned) {
        long l = asLong(left);
        long r = asLong(right);
        if (unsigned || left instanceof Pointer || right instanceof Pointer) {
            return Long.compareUnsigned(l, r);
        }
        return Long.compare(l, r);
    }
}
