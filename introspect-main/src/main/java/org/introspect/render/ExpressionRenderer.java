package org.introspect.render;

import org.introspect.ir.BinaryOp;
import org.introspect.ir.Call;
import org.introspect.ir.Cast;
import org.introspect.ir.Constant;
import org.introspect.ir.ExpressionNode;
import org.introspect.ir.LogicalAnd;
import org.introspect.ir.LogicalOr;
import org.introspect.ir.NodeVisitor;
import org.introspect.ir.NullPointer;
import org.introspect.ir.StringLiteral;
import org.introspect.ir.UnaryOp;
import org.introspect.ir.Unsupported;
import org.introspect.ir.Variable;

import java.util.StringJoiner;
import java.util.function.IntFunction;

/**
 * Renders a classified condition as source-like text.
 * <p>
 * The symbolic form spells every node, with conversions written out as casts.
 * The evaluated form substitutes the value of each leaf and writes {@code ...}
 * for nodes the report does not show. Both forms are produced by the same walk,
 * so they always agree structurally.
 * <p>
 * The substituted form spells a call with the values its arguments were
 * evaluated to, as in {@code strstr("hello world", "world")}. Literal arguments
 * keep their spelling.
 * <p>
 * Comparison and logical sub-results are parenthesized wherever they are nested;
 * arithmetic sub-results only when their precedence does not exceed their
 * parent's. The outermost expression is never parenthesized.
 */
public final class ExpressionRenderer {

    public static final String ELLIPSIS = "...";

    private static final int LOGICAL_AND_PRECEDENCE = 5;
    private static final int LOGICAL_OR_PRECEDENCE = 4;
    private static final int PRIMARY_PRECEDENCE = 15;
    private static final int ARGUMENT_PRECEDENCE = 0;

    public enum Form {
        SYMBOLIC,
        EVALUATED,
        SUBSTITUTED
    }

    private final Form form;
    private final Relevance relevance;
    private final IntFunction<String> valueTexts;
    private final ColorTable colors;
    private final Palette palette;

    private ExpressionRenderer(Form form, Relevance relevance, IntFunction<String> valueTexts,
                               ColorTable colors, Palette palette) {
        this.form = form;
        this.relevance = relevance;
        this.valueTexts = valueTexts;
        this.colors = colors;
        this.palette = palette;
    }

    /**
     * Symbolic form without colors. Used for the text of subexpression records.
     */
    public static ExpressionRenderer plain() {
        return new ExpressionRenderer(Form.SYMBOLIC, null, null, ColorTable.empty(), null);
    }

    public static ExpressionRenderer symbolic(ColorTable colors, Palette palette) {
        return new ExpressionRenderer(Form.SYMBOLIC, null, null, colors, palette);
    }

    /**
     * @param valueTexts formatted value by node id, asked only for shown leaves
     * @param palette    {@code null} for uncolored output
     */
    public static ExpressionRenderer evaluated(Relevance relevance, IntFunction<String> valueTexts,
                                               ColorTable colors, Palette palette) {
        return new ExpressionRenderer(Form.EVALUATED, relevance, valueTexts, colors, palette);
    }

    /**
     * Text of a call record: the callee applied to its argument values. Any other
     * root renders as in the evaluated form with nothing hidden.
     */
    public static ExpressionRenderer substituted(IntFunction<String> valueTexts) {
        return new ExpressionRenderer(Form.SUBSTITUTED, null, valueTexts, ColorTable.empty(), null);
    }

    public Form getForm() {
        return form;
    }

    public String render(ExpressionNode root) {
        Walker walker = new Walker();
        if (form == Form.SUBSTITUTED && root instanceof Call) {
            return walker.spell((Call) root);
        }
        return root.accept(walker);
    }

    private static int precedenceOf(ExpressionNode node) {
        if (node instanceof BinaryOp) {
            return ((BinaryOp) node).getOperator().getPrecedence();
        }
        if (node instanceof LogicalAnd) {
            return LOGICAL_AND_PRECEDENCE;
        }
        if (node instanceof LogicalOr) {
            return LOGICAL_OR_PRECEDENCE;
        }
        return PRIMARY_PRECEDENCE;
    }

    private static boolean needsParentheses(ExpressionNode child, int parentPrecedence) {
        if (child instanceof LogicalAnd || child instanceof LogicalOr) {
            return true;
        }
        if (child instanceof BinaryOp) {
            BinaryOp binary = (BinaryOp) child;
            return binary.getOperator().isComparison() || binary.getOperator().getPrecedence() <= parentPrecedence;
        }
        return false;
    }

    private final class Walker implements NodeVisitor<String> {

        private String child(ExpressionNode child, int parentPrecedence) {
            String text = child.accept(this);
            return needsParentheses(child, parentPrecedence) ? "(" + text + ")" : text;
        }

        private boolean hidden(ExpressionNode node) {
            return form == Form.EVALUATED && !relevance.isShown(node.getId());
        }

        private String leaf(ExpressionNode node, String symbolicText) {
            if (hidden(node)) {
                return ELLIPSIS;
            }
            String text = form == Form.SYMBOLIC || (form == Form.SUBSTITUTED && node.isLiteral())
                    ? symbolicText
                    : valueTexts.apply(node.getId());
            if (palette != null && colors.hasColor(node.getId())) {
                return palette.paint(text, colors.colorOf(node.getId()));
            }
            return text;
        }

        @Override
        public String visit(Variable n) {
            return leaf(n, n.getName());
        }

        @Override
        public String visit(Constant n) {
            return leaf(n, n.getLiteralText());
        }

        @Override
        public String visit(StringLiteral n) {
            return leaf(n, n.getText());
        }

        @Override
        public String visit(NullPointer n) {
            return leaf(n, n.getSpelling());
        }

        @Override
        public String visit(Cast n) {
            if (form != Form.SYMBOLIC) {
                return leaf(n, null);
            }
            return leaf(n, "(" + n.getType().getName() + ")" + child(n.getInner(), PRIMARY_PRECEDENCE));
        }

        @Override
        public String visit(UnaryOp n) {
            if (n.isAddressOf()) {
                return leaf(n, "&" + n.getOperand().accept(this));
            }
            if (hidden(n)) {
                return ELLIPSIS;
            }
            ExpressionNode operand = n.getOperand();
            String text = operand instanceof UnaryOp && !((UnaryOp) operand).isAddressOf()
                    ? "(" + operand.accept(this) + ")"
                    : child(operand, PRIMARY_PRECEDENCE);
            return n.getOperator().getSymbol() + text;
        }

        @Override
        public String visit(BinaryOp n) {
            if (hidden(n)) {
                return ELLIPSIS;
            }
            int precedence = precedenceOf(n);
            return child(n.getLeft(), precedence) + " " + n.getOperator().getSymbol() + " "
                    + child(n.getRight(), precedence);
        }

        @Override
        public String visit(LogicalAnd n) {
            if (hidden(n)) {
                return ELLIPSIS;
            }
            return child(n.getLeft(), LOGICAL_AND_PRECEDENCE) + " && " + child(n.getRight(), LOGICAL_AND_PRECEDENCE);
        }

        @Override
        public String visit(LogicalOr n) {
            if (hidden(n)) {
                return ELLIPSIS;
            }
            return child(n.getLeft(), LOGICAL_OR_PRECEDENCE) + " || " + child(n.getRight(), LOGICAL_OR_PRECEDENCE);
        }

        @Override
        public String visit(Call n) {
            if (form != Form.SYMBOLIC) {
                return leaf(n, null);
            }
            return leaf(n, spell(n));
        }

        private String spell(Call n) {
            StringJoiner arguments = new StringJoiner(", ", n.getCallee() + "(", ")");
            for (ExpressionNode argument : n.getArguments()) {
                arguments.add(child(argument, ARGUMENT_PRECEDENCE));
            }
            return arguments.toString();
        }

        @Override
        public String visit(Unsupported n) {
            return ELLIPSIS;
        }
    }
}
