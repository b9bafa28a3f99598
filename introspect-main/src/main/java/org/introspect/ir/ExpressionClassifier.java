package org.introspect.ir;

import org.introspect.host.DiagnosticSink;
import org.introspect.host.TreeCode;
import org.introspect.host.TypedExpression;
import org.introspect.types.CType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a host {@link TypedExpression} onto the closed {@link ExpressionNode} shapes.
 * <p>
 * Explicit casts and promotions of leaves become {@link Cast} nodes, chains
 * included. Implicit conversions of compound operands are looked through so the
 * rendering follows the surface syntax; the enclosing node keeps the conversion
 * target as its operation or parameter type. Anything without a rule becomes
 * {@link Unsupported}. Classification itself never fails; a tree that already
 * carries an error is refused up front.
 */
public class ExpressionClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionClassifier.class);

    public static final String PREVIOUS_ERROR_MESSAGE = "assertion rewriting skipped: previous error in expression";

    private static final Map<TreeCode, BinaryOperator> BINARY_OPERATORS = new EnumMap<>(TreeCode.class);
    private static final Map<TreeCode, UnaryOperator> UNARY_OPERATORS = new EnumMap<>(TreeCode.class);

    static {
        BINARY_OPERATORS.put(TreeCode.PLUS, BinaryOperator.ADD);
        BINARY_OPERATORS.put(TreeCode.MINUS, BinaryOperator.SUBTRACT);
        BINARY_OPERATORS.put(TreeCode.MULT, BinaryOperator.MULTIPLY);
        BINARY_OPERATORS.put(TreeCode.TRUNC_DIV, BinaryOperator.DIVIDE);
        BINARY_OPERATORS.put(TreeCode.TRUNC_MOD, BinaryOperator.REMAINDER);
        BINARY_OPERATORS.put(TreeCode.BIT_AND, BinaryOperator.BIT_AND);
        BINARY_OPERATORS.put(TreeCode.BIT_IOR, BinaryOperator.BIT_OR);
        BINARY_OPERATORS.put(TreeCode.BIT_XOR, BinaryOperator.BIT_XOR);
        BINARY_OPERATORS.put(TreeCode.LSHIFT, BinaryOperator.SHIFT_LEFT);
        BINARY_OPERATORS.put(TreeCode.RSHIFT, BinaryOperator.SHIFT_RIGHT);
        BINARY_OPERATORS.put(TreeCode.EQ, BinaryOperator.EQUALS);
        BINARY_OPERATORS.put(TreeCode.NE, BinaryOperator.NOT_EQUALS);
        BINARY_OPERATORS.put(TreeCode.LT, BinaryOperator.LESS);
        BINARY_OPERATORS.put(TreeCode.LE, BinaryOperator.LESS_EQUALS);
        BINARY_OPERATORS.put(TreeCode.GT, BinaryOperator.GREATER);
        BINARY_OPERATORS.put(TreeCode.GE, BinaryOperator.GREATER_EQUALS);

        UNARY_OPERATORS.put(TreeCode.NEGATE, UnaryOperator.NEGATE);
        UNARY_OPERATORS.put(TreeCode.BIT_NOT, UnaryOperator.BIT_NOT);
        UNARY_OPERATORS.put(TreeCode.TRUTH_NOT, UnaryOperator.LOGICAL_NOT);
        UNARY_OPERATORS.put(TreeCode.ADDRESS_OF, UnaryOperator.ADDRESS_OF);
    }

    /**
     * Classifies a condition, or reports {@link #PREVIOUS_ERROR_MESSAGE} and returns
     * empty when any part of it was already rejected by the host.
     */
    public Optional<ExpressionNode> classify(TypedExpression condition, DiagnosticSink diagnostics) {
        if (condition.containsError()) {
            LOG.warn("Skipping rewrite of '{}': expression carries a previous error", condition.getSourceText());
            diagnostics.error(PREVIOUS_ERROR_MESSAGE, condition.getSourceText());
            return Optional.empty();
        }
        ExpressionNode root = new Pass().classify(condition);
        LOG.debug("Classified '{}' into {} nodes", condition.getSourceText(), root.size());
        return Optional.of(root);
    }

    /**
     * Id allocation for one tree.
     */
    private static final class Pass {

        private int nextId;

        ExpressionNode classify(TypedExpression expr) {
            int id = nextId++;
            TreeCode code = expr.getCode();
            switch (code) {
                case VARIABLE:
                    return new Variable(id, expr.getName(), expr.getType());
                case INTEGER_CONSTANT:
                    if (expr.isNullPointerConstant()) {
                        return new NullPointer(id, expr.getSourceText(), expr.getType());
                    }
                    return new Constant(id, expr.getSourceText(), expr.getIntegerValue(), expr.getType());
                case STRING_CONSTANT:
                    return new StringLiteral(id, expr.getSourceText(), expr.getStringValue());
                case CONVERT:
                    return classifyConvert(id, expr);
                case TRUTH_ANDIF: {
                    ExpressionNode left = classify(expr.getOperand(0));
                    ExpressionNode right = classify(expr.getOperand(1));
                    return new LogicalAnd(id, left, right);
                }
                case TRUTH_ORIF: {
                    ExpressionNode left = classify(expr.getOperand(0));
                    ExpressionNode right = classify(expr.getOperand(1));
                    return new LogicalOr(id, left, right);
                }
                case CALL: {
                    List<ExpressionNode> arguments = new ArrayList<>();
                    List<CType> parameterTypes = new ArrayList<>();
                    for (TypedExpression argument : expr.getOperands()) {
                        parameterTypes.add(argument.getType());
                        arguments.add(classify(argument));
                    }
                    return new Call(id, expr.getName(), arguments, parameterTypes, expr.getType());
                }
                default:
                    break;
            }
            if (code == TreeCode.ADDRESS_OF && expr.getOperand(0).getCode() != TreeCode.VARIABLE) {
                LOG.debug("Address of a non-variable, keeping '{}' opaque", expr.getSourceText());
                return new Unsupported(id, expr.getSourceText(), expr.getType());
            }
            if (UNARY_OPERATORS.containsKey(code)) {
                ExpressionNode operand = classify(expr.getOperand(0));
                return new UnaryOp(id, UNARY_OPERATORS.get(code), operand, expr.getType());
            }
            if (BINARY_OPERATORS.containsKey(code)) {
                // the operation type is the converted left operand's, which a look-through would hide
                CType operationType = expr.getOperand(0).getType().unqualified();
                ExpressionNode left = classify(expr.getOperand(0));
                ExpressionNode right = classify(expr.getOperand(1));
                return new BinaryOp(id, BINARY_OPERATORS.get(code), left, right, operationType, expr.getType());
            }
            LOG.debug("No classifier rule for {}, keeping '{}' opaque", code, expr.getSourceText());
            return new Unsupported(id, expr.getSourceText(), expr.getType());
        }

        private ExpressionNode classifyConvert(int id, TypedExpression expr) {
            TypedExpression operand = expr.getOperand(0);
            CType target = expr.getType();
            if (expr.isImplicit()) {
                if (target.isPointer() && operand.getCode() == TreeCode.INTEGER_CONSTANT
                        && operand.getIntegerValue() == 0L) {
                    return new NullPointer(id, operand.getSourceText(), target);
                }
                if (target.isIntegral() && operand.getCode() == TreeCode.INTEGER_CONSTANT) {
                    return new Constant(id, operand.getSourceText(), operand.getIntegerValue(), target);
                }
                if (isCompound(operand) || operand.getType().unqualified().equals(target.unqualified())) {
                    nextId = id;
                    return classify(operand);
                }
            }
            ExpressionNode inner = classify(operand);
            return new Cast(id, inner, target, expr.isImplicit());
        }

        private static boolean isCompound(TypedExpression expr) {
            TreeCode code = expr.getCode();
            return code.isBinary() || (code.isUnary() && code != TreeCode.ADDRESS_OF);
        }
    }
}
