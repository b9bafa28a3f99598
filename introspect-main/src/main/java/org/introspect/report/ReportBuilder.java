package org.introspect.report;

import org.introspect.format.ValueFormatter;
import org.introspect.ir.Call;
import org.introspect.ir.Cast;
import org.introspect.ir.ExpressionNode;
import org.introspect.ir.NodeVisitorWithDefaults;
import org.introspect.ir.Unsupported;
import org.introspect.recorder.EvaluationFrame;
import org.introspect.recorder.EvaluationRecord;
import org.introspect.recorder.InstrumentedAssertion;
import org.introspect.recorder.SlotTable;
import org.introspect.render.ColorAssignor;
import org.introspect.render.ColorTable;
import org.introspect.render.ExpressionRenderer;
import org.introspect.render.Palette;
import org.introspect.render.Relevance;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Turns a failed evaluation into an {@link AssertionReport}.
 * <p>
 * Only shown records are listed. Literals and unsupported nodes never are, nor
 * is a promotion whose value reads the same as its operand's. A call is listed
 * with its argument values substituted.
 */
public class ReportBuilder {

    private final ValueFormatter formatter;
    private final Palette palette;

    /**
     * @param palette {@code null} for a report without colors
     */
    public ReportBuilder(ValueFormatter formatter, Palette palette) {
        this.formatter = formatter;
        this.palette = palette;
    }

    public AssertionReport build(InstrumentedAssertion assertion, EvaluationFrame frame) {
        ExpressionNode root = assertion.getRoot();
        SlotTable slots = frame.slots();
        Relevance relevance = Relevance.analyze(root, frame);

        Map<Integer, String> valueTexts = new HashMap<>();
        List<EvaluationRecord> listed = new ArrayList<>();
        RecordText recordText = new RecordText(valueTexts::get);
        for (int slot : frame.recordedSlots()) {
            ExpressionNode node = slots.node(slot);
            String valueText = formatter.format(frame.slotValue(slot), node.getType());
            valueTexts.put(node.getId(), valueText);
            if (!relevance.isShown(node.getId()) || node.isLiteral() || node instanceof Unsupported) {
                continue;
            }
            if (isRedundantPromotion(node, valueText, valueTexts)) {
                continue;
            }
            listed.add(new EvaluationRecord(node.getId(), node.accept(recordText), frame.orderIndex(slot), valueText,
                    EvaluationRecord.NO_COLOR));
        }

        ColorTable colors = palette == null
                ? ColorTable.empty()
                : new ColorAssignor(palette.size()).assign(root, listed);
        List<EvaluationRecord> records = new ArrayList<>(listed.size());
        List<String> lines = new ArrayList<>(listed.size());
        for (EvaluationRecord record : listed) {
            EvaluationRecord colored = record.withColor(colors.colorOf(record.nodeId()));
            records.add(colored);
            lines.add("  " + paint(colored.text(), colored) + " = " + paint(colored.valueText(), colored));
        }

        String primitive = assertion.getPrimitive();
        String symbolic = ExpressionRenderer.symbolic(colors, palette).render(root);
        String evaluated = ExpressionRenderer.evaluated(relevance, valueTexts::get, colors, palette).render(root);
        return new AssertionReport(
                "> " + primitive + "(" + assertion.getSourceText() + ")",
                "A " + primitive + "(" + symbolic + ")",
                "E " + primitive + "(" + evaluated + ")",
                lines,
                records);
    }

    private String paint(String text, EvaluationRecord record) {
        return palette != null && record.hasColor() ? palette.paint(text, record.colorId()) : text;
    }

    private static final class RecordText extends NodeVisitorWithDefaults<String> {

        private final ExpressionRenderer plain = ExpressionRenderer.plain();
        private final ExpressionRenderer substituted;

        RecordText(IntFunction<String> valueTexts) {
            this.substituted = ExpressionRenderer.substituted(valueTexts);
        }

        @Override
        public String visit(Call n) {
            return substituted.render(n);
        }

        @Override
        public String defaultAction(ExpressionNode n) {
            return plain.render(n);
        }
    }

    private static boolean isRedundantPromotion(ExpressionNode node, String valueText, Map<Integer, String> valueTexts) {
        if (!(node instanceof Cast) || !((Cast) node).isPromotion()) {
            return false;
        }
        return valueText.equals(valueTexts.get(((Cast) node).getInner().getId()));
    }
}
