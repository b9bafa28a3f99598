package org.introspect.recorder;

import org.introspect.ExpressionEvaluationException;
import org.introspect.ir.BinaryOperator;
import org.introspect.ir.UnaryOperator;
import org.introspect.runtime.Pointer;
import org.introspect.runtime.Values;
import org.introspect.types.CType;

/**
 * C operator semantics over the engine's value representation.
 */
final class Operations {

    private Operations() {}

    static Object unary(UnaryOperator operator, Object operand, CType type) {
        return switch (operator) {
            case NEGATE -> Values.normalize(-Values.asLong(Values.convert(operand, type)), type);
            case BIT_NOT -> Values.normalize(~Values.asLong(Values.convert(operand, type)), type);
            case LOGICAL_NOT -> Values.isTrue(operand) ? 0L : 1L;
            case ADDRESS_OF -> throw new IllegalStateException("Address-of is recorded as a leaf");
        };
    }

    static Object binary(BinaryOperator operator, Object left, Object right, CType operationType, CType resultType) {
        if (operator.isComparison()) {
            return compare(operator, left, right, operationType) ? 1L : 0L;
        }
        if (left instanceof Pointer || right instanceof Pointer) {
            return pointerArithmetic(operator, left, right, operationType, resultType);
        }

        long a = Values.asLong(Values.convert(left, operationType));
        boolean shift = operator == BinaryOperator.SHIFT_LEFT || operator == BinaryOperator.SHIFT_RIGHT;
        long b = shift ? Values.asLong(right) : Values.asLong(Values.convert(right, operationType));
        boolean unsigned = operationType.isUnsigned();

        long result = switch (operator) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> {
                requireNonZero(b);
                yield unsigned ? Long.divideUnsigned(a, b) : a / b;
            }
            case REMAINDER -> {
                requireNonZero(b);
                yield unsigned ? Long.remainderUnsigned(a, b) : a % b;
            }
            case BIT_AND -> a & b;
            case BIT_OR -> a | b;
            case BIT_XOR -> a ^ b;
            case SHIFT_LEFT -> a << b;
            case SHIFT_RIGHT -> unsigned ? a >>> b : a >> b;
            default -> throw new IllegalStateException("Not an arithmetic operator: " + operator);
        };
        return Values.normalize(result, resultType);
    }

    private static boolean compare(BinaryOperator operator, Object left, Object right, CType operationType) {
        Object l = left instanceof Pointer ? left : Values.convert(left, operationType);
        Object r = right instanceof Pointer ? right : Values.convert(right, operationType);
        int cmp = Values.compare(l, r, operationType.isUnsigned());
        return switch (operator) {
            case EQUALS -> cmp == 0;
            case NOT_EQUALS -> cmp != 0;
            case LESS -> cmp < 0;
            case LESS_EQUALS -> cmp <= 0;
            case GREATER -> cmp > 0;
            case GREATER_EQUALS -> cmp >= 0;
            default -> throw new IllegalStateException("Not a comparison: " + operator);
        };
    }

    private static Object pointerArithmetic(BinaryOperator operator, Object left, Object right,
                                            CType operationType, CType resultType) {
        if (left instanceof Pointer && right instanceof Pointer) {
            if (operator != BinaryOperator.SUBTRACT) {
                throw new ExpressionEvaluationException("Invalid pointer operation: " + operator.getSymbol());
            }
            long size = operationType.isPointer() ? operationType.getPointee().sizeOf() : 1;
            return (((Pointer) left).getAddress() - ((Pointer) right).getAddress()) / size;
        }
        long size = resultType.isPointer() ? resultType.getPointee().sizeOf() : 1;
        if (left instanceof Pointer) {
            long offset = Values.asLong(right) * size;
            return switch (operator) {
                case ADD -> ((Pointer) left).plus(offset);
                case SUBTRACT -> ((Pointer) left).plus(-offset);
                default -> throw new ExpressionEvaluationException("Invalid pointer operation: " + operator.getSymbol());
            };
        }
        if (operator != BinaryOperator.ADD) {
            throw new ExpressionEvaluationException("Invalid pointer operation: " + operator.getSymbol());
        }
        return ((Pointer) right).plus(Values.asLong(left) * size);
    }

    private static void requireNonZero(long divisor) {
        if (divisor == 0L) {
            throw new ExpressionEvaluationException("Division by zero");
        }
    }
}
