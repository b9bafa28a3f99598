package org.introspect.host;

import org.introspect.types.CType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The host's typed view of an assertion condition: one node per expression with
 * its static type and source text. Trees are built by a front end (see
 * {@link JavaParserFrontEnd}) or directly through the factory methods, which derive
 * the source text of composite nodes from their operands.
 */
public final class TypedExpression {

    private final TreeCode code;
    private final CType type;
    private final String sourceText;
    private final List<TypedExpression> operands;
    private final String name;
    private final long integerValue;
    private final String stringValue;
    private final boolean implicit;

    private TypedExpression(TreeCode code, CType type, String sourceText, List<TypedExpression> operands,
                            String name, long integerValue, String stringValue, boolean implicit) {
        this.code = code;
        this.type = type;
        this.sourceText = sourceText;
        this.operands = List.copyOf(operands);
        this.name = name;
        this.integerValue = integerValue;
        this.stringValue = stringValue;
        this.implicit = implicit;
    }

    public static TypedExpression variable(String name, CType type) {
        return new TypedExpression(TreeCode.VARIABLE, type, name, List.of(), name, 0L, null, false);
    }

    public static TypedExpression integer(String literalText, long value, CType type) {
        return new TypedExpression(TreeCode.INTEGER_CONSTANT, type, literalText, List.of(), null, value, null, false);
    }

    public static TypedExpression integer(long value) {
        return integer(Long.toString(value), value, CType.INT);
    }

    /**
     * A null pointer constant such as {@code NULL}.
     */
    public static TypedExpression nullPointer(String spelling) {
        return new TypedExpression(TreeCode.INTEGER_CONSTANT, CType.VOID_POINTER, spelling, List.of(), null, 0L, null, false);
    }

    /**
     * @param literalText the literal as written, quotes included
     * @param value       the literal's characters after escape processing
     */
    public static TypedExpression string(String literalText, String value) {
        return new TypedExpression(TreeCode.STRING_CONSTANT, CType.CHAR_POINTER, literalText, List.of(), null, 0L, value, false);
    }

    public static TypedExpression string(String value) {
        return string('"' + value + '"', value);
    }

    public static TypedExpression convert(CType target, TypedExpression operand, boolean implicit) {
        String text = implicit ? operand.sourceText : "(" + target.getName() + ")" + operand.sourceText;
        return new TypedExpression(TreeCode.CONVERT, target, text, List.of(operand), null, 0L, null, implicit);
    }

    public static TypedExpression unary(TreeCode code, CType type, TypedExpression operand) {
        if (!code.isUnary()) {
            throw new IllegalArgumentException("Not a unary code: " + code);
        }
        return new TypedExpression(code, type, code.getSymbol() + operand.sourceText, List.of(operand), null, 0L, null, false);
    }

    public static TypedExpression addressOf(TypedExpression operand) {
        return unary(TreeCode.ADDRESS_OF, CType.pointerTo(operand.type), operand);
    }

    public static TypedExpression binary(TreeCode code, CType type, TypedExpression left, TypedExpression right) {
        if (!code.isBinary()) {
            throw new IllegalArgumentException("Not a binary code: " + code);
        }
        String text = left.sourceText + " " + code.getSymbol() + " " + right.sourceText;
        return new TypedExpression(code, type, text, List.of(left, right), null, 0L, null, false);
    }

    public static TypedExpression call(String function, CType returnType, List<TypedExpression> arguments) {
        String text = function + "(" + arguments.stream()
                .map(TypedExpression::getSourceText)
                .collect(Collectors.joining(", ")) + ")";
        return new TypedExpression(TreeCode.CALL, returnType, text, arguments, function, 0L, null, false);
    }

    /**
     * A node the front end does not break down further, like a member access or subscript.
     */
    public static TypedExpression opaque(TreeCode code, String sourceText, CType type) {
        return new TypedExpression(code, type, sourceText, List.of(), null, 0L, null, false);
    }

    public static TypedExpression error(String sourceText) {
        return new TypedExpression(TreeCode.ERROR_MARK, CType.INT, sourceText, List.of(), null, 0L, null, false);
    }

    /**
     * Replaces the derived source text with the text as written.
     */
    public TypedExpression withSourceText(String text) {
        return new TypedExpression(code, type, text, operands, name, integerValue, stringValue, implicit);
    }

    public TreeCode getCode() {
        return code;
    }

    public CType getType() {
        return type;
    }

    public String getSourceText() {
        return sourceText;
    }

    public List<TypedExpression> getOperands() {
        return operands;
    }

    public TypedExpression getOperand(int index) {
        return operands.get(index);
    }

    public String getName() {
        return name;
    }

    public long getIntegerValue() {
        return integerValue;
    }

    public String getStringValue() {
        return stringValue;
    }

    public boolean isImplicit() {
        return implicit;
    }

    public boolean isNullPointerConstant() {
        return code == TreeCode.INTEGER_CONSTANT && type.isPointer() && integerValue == 0L;
    }

    public boolean containsError() {
        if (code == TreeCode.ERROR_MARK) {
            return true;
        }
        for (TypedExpression operand : operands) {
            if (operand.containsError()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return code + "[" + type + "] " + sourceText;
    }
}
