package org.introspect.render;

import org.introspect.ir.BinaryOp;
import org.introspect.ir.BinaryOperator;
import org.introspect.ir.Call;
import org.introspect.ir.Cast;
import org.introspect.ir.Constant;
import org.introspect.ir.ExpressionNode;
import org.introspect.ir.LogicalAnd;
import org.introspect.ir.LogicalOr;
import org.introspect.ir.StringLiteral;
import org.introspect.ir.UnaryOp;
import org.introspect.ir.UnaryOperator;
import org.introspect.ir.Unsupported;
import org.introspect.ir.Variable;
import org.introspect.recorder.EvaluationFrame;
import org.introspect.recorder.EvaluationRecorder;
import org.introspect.recorder.InstrumentedAssertion;
import org.introspect.runtime.SimulatedEnvironment;
import org.introspect.types.CType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExpressionRendererTest {

    private int nextId;

    private Variable var(String name) {
        return new Variable(nextId++, name, CType.INT);
    }

    private Constant constant(long value) {
        return new Constant(nextId++, Long.toString(value), value, CType.INT);
    }

    private BinaryOp binary(BinaryOperator operator, ExpressionNode left, ExpressionNode right) {
        return new BinaryOp(nextId++, operator, left, right, CType.INT, CType.INT);
    }

    private static String plain(ExpressionNode node) {
        return ExpressionRenderer.plain().render(node);
    }

    // ── symbolic form ──

    @Test
    void outermostExpression_isNeverWrapped() {
        assertThat(plain(binary(BinaryOperator.EQUALS, var("n"), constant(5)))).isEqualTo("n == 5");
    }

    @Test
    void nestedComparisonsAndLogicals_areAlwaysWrapped() {
        ExpressionNode root = new LogicalOr(nextId++,
                new LogicalAnd(nextId++, binary(BinaryOperator.LESS, var("a"), var("b")), var("c")),
                new UnaryOp(nextId++, UnaryOperator.LOGICAL_NOT, binary(BinaryOperator.EQUALS, var("d"), constant(0)),
                        CType.INT));

        assertThat(plain(root)).isEqualTo("((a < b) && c) || !(d == 0)");
    }

    @Test
    void arithmetic_isWrappedOnlyWhereNeeded() {
        ExpressionNode lowerInsideHigher = binary(BinaryOperator.MULTIPLY,
                binary(BinaryOperator.ADD, var("a"), var("b")), var("c"));
        ExpressionNode higherInsideLower = binary(BinaryOperator.ADD,
                binary(BinaryOperator.MULTIPLY, var("a"), var("b")), var("c"));
        ExpressionNode rightAssociated = binary(BinaryOperator.SUBTRACT,
                var("a"), binary(BinaryOperator.SUBTRACT, var("b"), var("c")));

        assertThat(plain(lowerInsideHigher)).isEqualTo("(a + b) * c");
        assertThat(plain(higherInsideLower)).isEqualTo("a * b + c");
        assertThat(plain(rightAssociated)).isEqualTo("a - (b - c)");
    }

    @Test
    void arithmeticUnderComparison_isNotWrapped() {
        ExpressionNode root = binary(BinaryOperator.EQUALS,
                binary(BinaryOperator.ADD, new Cast(nextId++, var("x"), CType.INT, false), constant(5)),
                new Cast(nextId++, new Cast(nextId++, var("n"), CType.SHORT, false), CType.INT, false));

        assertThat(plain(root)).isEqualTo("(int)x + 5 == (int)(short int)n");
    }

    @Test
    void castOfCompound_wrapsOperand() {
        ExpressionNode root = new Cast(nextId++, binary(BinaryOperator.ADD, var("a"), var("b")), CType.LONG, false);

        assertThat(plain(root)).isEqualTo("(long int)(a + b)");
    }

    @Test
    void nestedNegation_staysUnambiguous() {
        ExpressionNode root = new UnaryOp(nextId++, UnaryOperator.NEGATE,
                new UnaryOp(nextId++, UnaryOperator.NEGATE, var("a"), CType.INT), CType.INT);

        assertThat(plain(root)).isEqualTo("-(-a)");
    }

    @Test
    void callArguments_wrapOnlyComparisons() {
        ExpressionNode root = new Call(nextId++, "f",
                List.of(binary(BinaryOperator.ADD, var("a"), var("b")), binary(BinaryOperator.LESS, var("a"), var("b")),
                        new StringLiteral(nextId++, "\"x\"", "x")),
                List.of(CType.INT, CType.INT, CType.CHAR_POINTER), CType.INT);

        assertThat(plain(root)).isEqualTo("f(a + b, (a < b), \"x\")");
    }

    @Test
    void unsupported_isAnEllipsis() {
        ExpressionNode root = binary(BinaryOperator.GREATER, new Unsupported(nextId++, "a[i]", CType.INT), constant(0));

        assertThat(plain(root)).isEqualTo("... > 0");
    }

    // ── evaluated form ──

    @Test
    void evaluatedForm_substitutesLeafValues() {
        Variable n = var("n");
        Call f = new Call(nextId++, "f", List.of(var("m")), List.of(CType.INT), CType.INT);
        ExpressionNode root = binary(BinaryOperator.LESS, n, f);
        Map<Integer, String> values = Map.of(n.getId(), "3", f.getId(), "-1", f.getArguments().get(0).getId(), "9");
        Relevance relevance = Relevance.analyze(root, evaluate(root));

        String text = ExpressionRenderer.evaluated(relevance, values::get, ColorTable.empty(), null).render(root);

        assertThat(text).isEqualTo("3 < -1");
    }

    @Test
    void evaluatedForm_hidesUnreachedSubtrees() {
        nextId = 0;
        LogicalAnd root = new LogicalAnd(nextId++, binary(BinaryOperator.EQUALS, var("n"), constant(1)),
                binary(BinaryOperator.EQUALS, var("m"), constant(2)));
        EvaluationFrame frame = evaluate(root, new SimulatedEnvironment().set("n", 0).set("m", 2));
        Relevance relevance = Relevance.analyze(root, frame);

        String text = ExpressionRenderer.evaluated(relevance, id -> String.valueOf(frame.valueOf(id)),
                ColorTable.empty(), null).render(root);

        assertThat(text).isEqualTo("(0 == 1) && (...)");
    }

    // ── substituted form ──

    @Test
    void substitutedForm_spellsCallWithArgumentValues() {
        Constant twelve = constant(12);
        Variable a = var("a");
        Variable b = var("b");
        Call g = new Call(nextId++, "g", List.of(var("c")), List.of(CType.INT), CType.INT);
        StringLiteral x = new StringLiteral(nextId++, "\"x\"", "x");
        Call f = new Call(nextId++, "f", List.of(twelve, binary(BinaryOperator.ADD, a, b), g, x),
                List.of(CType.INT, CType.INT, CType.INT, CType.CHAR_POINTER), CType.INT);
        Map<Integer, String> values = Map.of(twelve.getId(), "12", a.getId(), "1", b.getId(), "2",
                g.getId(), "7", x.getId(), "\"x\"", f.getId(), "0");

        String text = ExpressionRenderer.substituted(values::get).render(f);

        assertThat(text).isEqualTo("f(12, 1 + 2, 7, \"x\")");
    }

    @Test
    void substitutedForm_rendersNonCallAsValues() {
        Variable n = var("n");
        ExpressionNode root = binary(BinaryOperator.ADD, n, constant(5));

        assertThat(ExpressionRenderer.substituted(Map.of(n.getId(), "4")::get).render(root)).isEqualTo("4 + 5");
    }

    private static EvaluationFrame evaluate(ExpressionNode root) {
        SimulatedEnvironment environment = new SimulatedEnvironment()
                .set("n", 3)
                .set("m", 9)
                .define("f", args -> -1L);
        return evaluate(root, environment);
    }

    private static EvaluationFrame evaluate(ExpressionNode root, SimulatedEnvironment environment) {
        InstrumentedAssertion assertion = new EvaluationRecorder().rewrite("assert", "test", root);
        return assertion.evaluate(environment);
    }
}
