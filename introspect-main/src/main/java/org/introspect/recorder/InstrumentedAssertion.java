package org.introspect.recorder;

import org.introspect.ir.ExpressionNode;
import org.introspect.runtime.RuntimeEnvironment;
import org.introspect.runtime.Values;

/**
 * A rewritten assertion occurrence: the classified condition, its slot table and
 * the recording evaluation built from them. Immutable; every {@link #evaluate}
 * runs in a frame of its own, so one instance can be shared between threads.
 */
public final class InstrumentedAssertion {

    private final String primitive;
    private final String sourceText;
    private final ExpressionNode root;
    private final SlotTable slots;
    private final Step rootStep;

    InstrumentedAssertion(String primitive, String sourceText, ExpressionNode root, SlotTable slots, Step rootStep) {
        this.primitive = primitive;
        this.sourceText = sourceText;
        this.root = root;
        this.slots = slots;
        this.rootStep = rootStep;
    }

    /**
     * Runs the condition exactly as the original would, recording every leaf it reaches.
     */
    public EvaluationFrame evaluate(RuntimeEnvironment environment) {
        EvaluationFrame frame = new EvaluationFrame(environment, slots);
        Object value = rootStep.run(frame);
        frame.finish(Values.isTrue(value));
        return frame;
    }

    /**
     * Name of the assertion primitive, e.g. {@code assert}.
     */
    public String getPrimitive() {
        return primitive;
    }

    /**
     * The condition as written.
     */
    public String getSourceText() {
        return sourceText;
    }

    public ExpressionNode getRoot() {
        return root;
    }

    public SlotTable getSlots() {
        return slots;
    }
}
