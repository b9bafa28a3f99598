package org.introspect.host;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import org.introspect.ExpressionParseException;
import org.introspect.TypeResolutionException;
import org.introspect.types.CType;
import org.introspect.types.CTypes;
import org.introspect.types.Declarations;
import org.introspect.types.FunctionSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Front end that turns the text of a C assertion condition into a {@link TypedExpression}.
 * <p>
 * The condition is parsed with JavaParser, whose expression grammar covers the C
 * operators an assertion typically uses. Names are resolved against
 * {@link Declarations}, and the implicit conversions a C compiler performs (integer
 * promotion, the usual arithmetic conversions, argument conversion to parameter
 * types) are inserted as implicit {@link TreeCode#CONVERT} nodes. Problems are
 * reported to the {@link DiagnosticSink} and leave {@link TreeCode#ERROR_MARK} nodes
 * in the tree instead of throwing.
 */
public class JavaParserFrontEnd {

    private static final Logger LOG = LoggerFactory.getLogger(JavaParserFrontEnd.class);

    private static final Map<BinaryExpr.Operator, TreeCode> OPERATOR_MAP = Map.ofEntries(
            Map.entry(BinaryExpr.Operator.EQUALS, TreeCode.EQ),
            Map.entry(BinaryExpr.Operator.NOT_EQUALS, TreeCode.NE),
            Map.entry(BinaryExpr.Operator.LESS, TreeCode.LT),
            Map.entry(BinaryExpr.Operator.GREATER, TreeCode.GT),
            Map.entry(BinaryExpr.Operator.LESS_EQUALS, TreeCode.LE),
            Map.entry(BinaryExpr.Operator.GREATER_EQUALS, TreeCode.GE),
            Map.entry(BinaryExpr.Operator.AND, TreeCode.TRUTH_ANDIF),
            Map.entry(BinaryExpr.Operator.OR, TreeCode.TRUTH_ORIF),
            Map.entry(BinaryExpr.Operator.PLUS, TreeCode.PLUS),
            Map.entry(BinaryExpr.Operator.MINUS, TreeCode.MINUS),
            Map.entry(BinaryExpr.Operator.MULTIPLY, TreeCode.MULT),
            Map.entry(BinaryExpr.Operator.DIVIDE, TreeCode.TRUNC_DIV),
            Map.entry(BinaryExpr.Operator.REMAINDER, TreeCode.TRUNC_MOD),
            Map.entry(BinaryExpr.Operator.BINARY_AND, TreeCode.BIT_AND),
            Map.entry(BinaryExpr.Operator.BINARY_OR, TreeCode.BIT_IOR),
            Map.entry(BinaryExpr.Operator.XOR, TreeCode.BIT_XOR),
            Map.entry(BinaryExpr.Operator.LEFT_SHIFT, TreeCode.LSHIFT),
            Map.entry(BinaryExpr.Operator.SIGNED_RIGHT_SHIFT, TreeCode.RSHIFT)
    );

    private static final String NULL_MACRO = "NULL";

    private final Declarations declarations;
    private final JavaParser parser;

    public JavaParserFrontEnd(Declarations declarations) {
        this.declarations = declarations;
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    /**
     * Parses and type-checks a condition. Never throws for malformed input: syntax
     * and type errors are reported to {@code diagnostics} and yield error nodes.
     */
    public TypedExpression parse(String conditionSource, DiagnosticSink diagnostics) {
        ParseResult<Expression> result = parser.parseExpression(conditionSource);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            for (Problem problem : result.getProblems()) {
                diagnostics.error(problem.getMessage(), conditionSource);
            }
            if (result.getProblems().isEmpty()) {
                diagnostics.error("expected expression", conditionSource);
            }
            return TypedExpression.error(conditionSource);
        }
        return new Checker(diagnostics).check(result.getResult().get());
    }

    /**
     * Variant for callers outside a build: parse failures are raised instead of reported.
     *
     * @throws ExpressionParseException if the text is not a well-formed expression
     */
    public TypedExpression parseOrThrow(String conditionSource) {
        ParseResult<Expression> result = parser.parseExpression(conditionSource);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            Problem first = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
            int line = 0;
            int column = 0;
            if (first != null && first.getLocation().isPresent()) {
                Optional<com.github.javaparser.Range> range = first.getLocation().get().toRange();
                if (range.isPresent()) {
                    line = range.get().begin.line;
                    column = range.get().begin.column;
                }
            }
            String message = first == null ? "Parse error" : "Parse error: " + first.getMessage();
            throw new ExpressionParseException(message, conditionSource, line, column);
        }
        CollectingDiagnosticSink diagnostics = new CollectingDiagnosticSink();
        return new Checker(diagnostics).check(result.getResult().get());
    }

    private static String sourceOf(Expression expr) {
        return expr.getTokenRange().map(TokenRange::toString).orElseGet(expr::toString);
    }

    /**
     * One checking pass over one condition; holds only the sink it reports to.
     */
    private final class Checker {

        private final DiagnosticSink diagnostics;

        private Checker(DiagnosticSink diagnostics) {
            this.diagnostics = diagnostics;
        }

        TypedExpression check(Expression expr) {
            if (expr instanceof EnclosedExpr) {
                return check(((EnclosedExpr) expr).getInner());
            }
            if (expr instanceof NameExpr) {
                return checkName((NameExpr) expr);
            }
            if (expr instanceof IntegerLiteralExpr) {
                return checkIntegerConstant(((IntegerLiteralExpr) expr).getValue(), expr);
            }
            if (expr instanceof LongLiteralExpr) {
                return checkIntegerConstant(((LongLiteralExpr) expr).getValue(), expr);
            }
            if (expr instanceof CharLiteralExpr) {
                // C character constants have type int
                return TypedExpression.integer(sourceOf(expr), ((CharLiteralExpr) expr).asChar(), CType.INT);
            }
            if (expr instanceof BooleanLiteralExpr) {
                boolean value = ((BooleanLiteralExpr) expr).getValue();
                return TypedExpression.integer(sourceOf(expr), value ? 1L : 0L, CType.INT);
            }
            if (expr instanceof NullLiteralExpr) {
                return TypedExpression.nullPointer(sourceOf(expr));
            }
            if (expr instanceof StringLiteralExpr) {
                return TypedExpression.string(sourceOf(expr), ((StringLiteralExpr) expr).asString());
            }
            if (expr instanceof CastExpr) {
                return checkCast((CastExpr) expr);
            }
            if (expr instanceof UnaryExpr) {
                return checkUnary((UnaryExpr) expr);
            }
            if (expr instanceof BinaryExpr) {
                return checkBinary((BinaryExpr) expr);
            }
            if (expr instanceof MethodCallExpr && ((MethodCallExpr) expr).getScope().isEmpty()) {
                return checkCall((MethodCallExpr) expr);
            }
            if (expr instanceof FieldAccessExpr || expr instanceof MethodCallExpr) {
                return opaque(TreeCode.COMPONENT_REF, expr);
            }
            if (expr instanceof ArrayAccessExpr) {
                return opaque(TreeCode.ARRAY_REF, expr);
            }
            return opaque(TreeCode.OTHER, expr);
        }

        /**
         * Reads an integer constant by C rules. The type is the first of {@code int},
         * {@code unsigned int} (hexadecimal, octal and binary only), {@code long int}
         * and {@code long unsigned int} that holds the value; an {@code L} suffix
         * starts the ladder at {@code long int}.
         */
        private TypedExpression checkIntegerConstant(String literal, Expression expr) {
            String text = sourceOf(expr);
            String digits = literal.replace("_", "");
            boolean longSuffix = digits.endsWith("L") || digits.endsWith("l");
            if (longSuffix) {
                digits = digits.substring(0, digits.length() - 1);
            }
            int radix = 10;
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                radix = 16;
                digits = digits.substring(2);
            } else if (digits.startsWith("0b") || digits.startsWith("0B")) {
                radix = 2;
                digits = digits.substring(2);
            } else if (digits.length() > 1 && digits.startsWith("0")) {
                radix = 8;
                digits = digits.substring(1);
            }

            BigInteger value;
            try {
                value = new BigInteger(digits, radix);
            } catch (NumberFormatException e) {
                diagnostics.error("invalid integer constant '" + text + "'", text);
                return TypedExpression.error(text);
            }

            List<CType> candidates = new ArrayList<>();
            if (!longSuffix) {
                candidates.add(CType.INT);
                if (radix != 10) {
                    candidates.add(CType.UNSIGNED_INT);
                }
            }
            candidates.add(CType.LONG);
            candidates.add(CType.UNSIGNED_LONG);
            for (CType candidate : candidates) {
                int valueBits = candidate.isUnsigned() ? candidate.getBits() : candidate.getBits() - 1;
                if (value.bitLength() <= valueBits) {
                    if (radix == 10 && candidate.isUnsigned()) {
                        diagnostics.warning("integer constant is so large that it is unsigned", text);
                    }
                    return TypedExpression.integer(text, value.longValue(), candidate);
                }
            }
            diagnostics.error("integer constant is too large for its type", text);
            return TypedExpression.error(text);
        }

        private TypedExpression checkName(NameExpr expr) {
            String name = expr.getNameAsString();
            Optional<CType> type = declarations.variable(name);
            if (type.isPresent()) {
                return TypedExpression.variable(name, type.get());
            }
            if (NULL_MACRO.equals(name)) {
                return TypedExpression.nullPointer(name);
            }
            diagnostics.error("'" + name + "' undeclared", name);
            return TypedExpression.error(name);
        }

        private TypedExpression checkCast(CastExpr expr) {
            TypedExpression operand = check(expr.getExpression());
            String typeName = expr.getType().asString();
            CType target;
            try {
                target = declarations.resolveType(typeName);
            } catch (TypeResolutionException e) {
                diagnostics.error("unknown type name '" + typeName + "'", sourceOf(expr));
                return TypedExpression.error(sourceOf(expr));
            }
            if (!target.isScalar() || !operand.getType().isScalar()) {
                diagnostics.error("conversion to non-scalar type requested", sourceOf(expr));
                return TypedExpression.error(sourceOf(expr));
            }
            return TypedExpression.convert(target, operand, false).withSourceText(sourceOf(expr));
        }

        private TypedExpression checkUnary(UnaryExpr expr) {
            TypedExpression operand = check(expr.getExpression());
            switch (expr.getOperator()) {
                case PLUS:
                    return requireIntegral(operand, expr)
                            ? implicitConvert(operand, CTypes.promote(operand.getType()))
                            : TypedExpression.error(sourceOf(expr));
                case MINUS:
                case BITWISE_COMPLEMENT: {
                    if (!requireIntegral(operand, expr)) {
                        return TypedExpression.error(sourceOf(expr));
                    }
                    CType type = CTypes.promote(operand.getType());
                    TreeCode code = expr.getOperator() == UnaryExpr.Operator.MINUS ? TreeCode.NEGATE : TreeCode.BIT_NOT;
                    return TypedExpression.unary(code, type, implicitConvert(operand, type))
                            .withSourceText(sourceOf(expr));
                }
                case LOGICAL_COMPLEMENT:
                    return TypedExpression.unary(TreeCode.TRUTH_NOT, CType.INT, operand).withSourceText(sourceOf(expr));
                default:
                    // increments have side effects the engine cannot replay symbolically
                    return opaque(TreeCode.OTHER, expr);
            }
        }

        private TypedExpression checkBinary(BinaryExpr expr) {
            TreeCode code = OPERATOR_MAP.get(expr.getOperator());
            if (code == null) {
                diagnostics.error("expected expression before '" + expr.getOperator().asString() + "' token",
                        sourceOf(expr));
                return TypedExpression.error(sourceOf(expr));
            }
            TypedExpression left = check(expr.getLeft());
            TypedExpression right = check(expr.getRight());
            TypedExpression typed = typeBinary(code, left, right, expr);
            return typed.getCode() == TreeCode.ERROR_MARK ? typed : typed.withSourceText(sourceOf(expr));
        }

        private TypedExpression typeBinary(TreeCode code, TypedExpression left, TypedExpression right, BinaryExpr expr) {
            CType lt = left.getType();
            CType rt = right.getType();
            switch (code) {
                case TRUTH_ANDIF:
                case TRUTH_ORIF:
                    if (!lt.isScalar() || !rt.isScalar()) {
                        diagnostics.error("used non-scalar value where scalar is required", sourceOf(expr));
                        return TypedExpression.error(sourceOf(expr));
                    }
                    return TypedExpression.binary(code, CType.INT, left, right);
                case EQ:
                case NE:
                case LT:
                case LE:
                case GT:
                case GE:
                    return typeComparison(code, left, right);
                case PLUS:
                case MINUS:
                    if (lt.isPointer() || rt.isPointer()) {
                        return typePointerArithmetic(code, left, right, expr);
                    }
                    return typeArithmetic(code, left, right, expr);
                case LSHIFT:
                case RSHIFT: {
                    if (!requireIntegral(left, expr) || !requireIntegral(right, expr)) {
                        return TypedExpression.error(sourceOf(expr));
                    }
                    CType type = CTypes.promote(lt);
                    return TypedExpression.binary(code, type, implicitConvert(left, type),
                            implicitConvert(right, CTypes.promote(rt)));
                }
                default:
                    return typeArithmetic(code, left, right, expr);
            }
        }

        private TypedExpression typeArithmetic(TreeCode code, TypedExpression left, TypedExpression right, BinaryExpr expr) {
            if (!requireIntegral(left, expr) || !requireIntegral(right, expr)) {
                return TypedExpression.error(sourceOf(expr));
            }
            CType common = CTypes.commonType(left.getType(), right.getType());
            return TypedExpression.binary(code, common, implicitConvert(left, common), implicitConvert(right, common));
        }

        private TypedExpression typePointerArithmetic(TreeCode code, TypedExpression left, TypedExpression right,
                                                      BinaryExpr expr) {
            CType lt = left.getType();
            CType rt = right.getType();
            if (lt.isPointer() && rt.isPointer()) {
                if (code != TreeCode.MINUS) {
                    diagnostics.error("invalid operands to binary " + code.getSymbol(), sourceOf(expr));
                    return TypedExpression.error(sourceOf(expr));
                }
                return TypedExpression.binary(code, CType.LONG, left, right);
            }
            if (lt.isPointer() && rt.isIntegral()) {
                return TypedExpression.binary(code, lt.unqualified(), left, implicitConvert(right, CType.LONG));
            }
            if (code == TreeCode.PLUS && rt.isPointer() && lt.isIntegral()) {
                return TypedExpression.binary(code, rt.unqualified(), implicitConvert(left, CType.LONG), right);
            }
            diagnostics.error("invalid operands to binary " + code.getSymbol(), sourceOf(expr));
            return TypedExpression.error(sourceOf(expr));
        }

        private TypedExpression typeComparison(TreeCode code, TypedExpression left, TypedExpression right) {
            CType lt = left.getType();
            CType rt = right.getType();
            if (lt.isPointer() || rt.isPointer()) {
                TypedExpression l = lt.isPointer() ? left : implicitConvert(left, rt.unqualified());
                TypedExpression r = rt.isPointer() ? right : implicitConvert(right, lt.unqualified());
                return TypedExpression.binary(code, CType.INT, l, r);
            }
            CType common = CTypes.commonType(lt, rt);
            return TypedExpression.binary(code, CType.INT, implicitConvert(left, common), implicitConvert(right, common));
        }

        private TypedExpression checkCall(MethodCallExpr expr) {
            String name = expr.getNameAsString();
            List<TypedExpression> arguments = new ArrayList<>();
            for (Expression argument : expr.getArguments()) {
                arguments.add(check(argument));
            }
            Optional<FunctionSignature> signature = declarations.function(name);
            if (signature.isEmpty()) {
                diagnostics.error("implicit declaration of function '" + name + "'", sourceOf(expr));
                return TypedExpression.error(sourceOf(expr));
            }
            FunctionSignature prototype = signature.get();
            if (!prototype.accepts(arguments.size())) {
                diagnostics.error("wrong number of arguments to function '" + name + "'", sourceOf(expr));
                return TypedExpression.error(sourceOf(expr));
            }
            List<TypedExpression> converted = new ArrayList<>();
            for (int i = 0; i < arguments.size(); i++) {
                TypedExpression argument = arguments.get(i);
                CType parameterType = i < prototype.parameterTypes().size()
                        ? prototype.parameterTypes().get(i)
                        : CTypes.promote(argument.getType());
                converted.add(parameterType.isPointer() && argument.getType().isPointer()
                        ? argument
                        : implicitConvert(argument, parameterType.unqualified()));
            }
            return TypedExpression.call(name, prototype.returnType(), converted).withSourceText(sourceOf(expr));
        }

        private TypedExpression opaque(TreeCode code, Expression expr) {
            String text = sourceOf(expr);
            CType type = declarations.opaqueExpression(text).orElseGet(() -> {
                LOG.debug("No declared type for '{}', assuming int", text);
                return CType.INT;
            });
            return TypedExpression.opaque(code, text, type);
        }

        private boolean requireIntegral(TypedExpression operand, Expression expr) {
            if (operand.getCode() == TreeCode.ERROR_MARK) {
                return false;
            }
            if (!operand.getType().isIntegral()) {
                diagnostics.error("invalid operand of type '" + operand.getType() + "'", sourceOf(expr));
                return false;
            }
            return true;
        }

        private TypedExpression implicitConvert(TypedExpression node, CType target) {
            if (node.getCode() == TreeCode.ERROR_MARK || node.getType().unqualified().equals(target)) {
                return node;
            }
            return TypedExpression.convert(target, node, true);
        }
    }
}
