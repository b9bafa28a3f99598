package org.introspect.render;

import org.introspect.ir.Call;
import org.introspect.ir.ExpressionNode;
import org.introspect.ir.Variable;
import org.introspect.recorder.EvaluationRecord;
import org.introspect.types.CType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ColorAssignorTest {

    private static EvaluationRecord record(ExpressionNode node, int orderIndex) {
        return new EvaluationRecord(node.getId(), "n" + node.getId(), orderIndex, "0", EvaluationRecord.NO_COLOR);
    }

    @Test
    void colors_cycleInEvaluationOrder() {
        Variable a = new Variable(0, "a", CType.INT);
        Variable b = new Variable(1, "b", CType.INT);
        Variable c = new Variable(2, "c", CType.INT);
        Call root = new Call(3, "f", List.of(a, b, c), List.of(CType.INT, CType.INT, CType.INT), CType.INT);

        ColorTable colors = new ColorAssignor(2).assign(root, List.of(record(a, 0), record(b, 1), record(c, 2)));

        assertThat(colors.colorOf(0)).isEqualTo(0);
        assertThat(colors.colorOf(1)).isEqualTo(1);
        assertThat(colors.colorOf(2)).isEqualTo(0);
        assertThat(colors.hasColor(3)).isFalse();
        assertThat(colors.colorOf(3)).isEqualTo(EvaluationRecord.NO_COLOR);
    }

    @Test
    void call_skipsColorsOfItsArguments() {
        // g(a, b, f(c)) in a palette of three
        Variable a = new Variable(1, "a", CType.INT);
        Variable b = new Variable(2, "b", CType.INT);
        Variable c = new Variable(4, "c", CType.INT);
        Call f = new Call(3, "f", List.of(c), List.of(CType.INT), CType.INT);
        Call g = new Call(0, "g", List.of(a, b, f), List.of(CType.INT, CType.INT, CType.INT), CType.INT);

        ColorTable colors = new ColorAssignor(3).assign(g,
                List.of(record(a, 0), record(b, 1), record(c, 2), record(f, 3), record(g, 4)));

        assertThat(colors.colorOf(a.getId())).isEqualTo(0);
        assertThat(colors.colorOf(b.getId())).isEqualTo(1);
        assertThat(colors.colorOf(c.getId())).isEqualTo(2);
        // f would take 0 next; c is its argument with 2, so 0 stays
        assertThat(colors.colorOf(f.getId())).isEqualTo(0);
        // g would take 1, which its argument b holds; a and f hold 0, so 2
        assertThat(colors.colorOf(g.getId())).isEqualTo(2);
    }

    @Test
    void independentOccurrences_getIndependentColors() {
        Variable first = new Variable(1, "n", CType.INT);
        Variable second = new Variable(2, "n", CType.INT);
        Call root = new Call(0, "max", List.of(first, second), List.of(CType.INT, CType.INT), CType.INT);

        ColorTable colors = new ColorAssignor(6).assign(root, List.of(record(first, 0), record(second, 1)));

        assertThat(colors.colorOf(1)).isNotEqualTo(colors.colorOf(2));
        assertThat(colors.size()).isEqualTo(2);
    }

    @Test
    void palette_paintReappliesOuterColorAfterNestedSpan() {
        Palette palette = Palette.DEFAULT;
        String inner = palette.paint("n", 0);

        String outer = palette.paint("f(" + inner + ")", 1);

        assertThat(outer).isEqualTo("\u001b[32mf(\u001b[31mn\u001b[0m\u001b[32m)\u001b[0m");
        assertThat(Palette.strip(outer)).isEqualTo("f(n)");
    }

    @Test
    void palette_wrapsAroundItsColors() {
        Palette palette = new Palette(List.of(91, 92));

        assertThat(palette.size()).isEqualTo(2);
        assertThat(palette.start(2)).isEqualTo(palette.start(0)).isEqualTo("\u001b[91m");
    }
}
