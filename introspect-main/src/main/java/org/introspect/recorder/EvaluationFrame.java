package org.introspect.recorder;

import org.introspect.runtime.RuntimeEnvironment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The storage of one invocation of an instrumented assertion: a value and a
 * reached flag per node, and a value and order index per slot. Frames are never
 * shared between invocations.
 */
public final class EvaluationFrame {

    private final RuntimeEnvironment environment;
    private final SlotTable slots;
    private final boolean[] reached;
    private final Object[] nodeValues;
    private final Object[] slotValues;
    private final int[] orderIndexes;
    private int nextOrderIndex;
    private Boolean outcome;

    EvaluationFrame(RuntimeEnvironment environment, SlotTable slots) {
        this.environment = environment;
        this.slots = slots;
        this.reached = new boolean[slots.nodeCount()];
        this.nodeValues = new Object[slots.nodeCount()];
        this.slotValues = new Object[slots.size()];
        this.orderIndexes = new int[slots.size()];
        Arrays.fill(orderIndexes, -1);
    }

    RuntimeEnvironment environment() {
        return environment;
    }

    void enter(int nodeId) {
        reached[nodeId] = true;
    }

    Object complete(int nodeId, Object value) {
        reached[nodeId] = true;
        nodeValues[nodeId] = value;
        return value;
    }

    Object record(int nodeId, int slot, Object value) {
        if (orderIndexes[slot] >= 0) {
            throw new IllegalStateException("Slot " + slot + " recorded twice");
        }
        orderIndexes[slot] = nextOrderIndex++;
        slotValues[slot] = value;
        return complete(nodeId, value);
    }

    void finish(boolean holds) {
        this.outcome = holds;
    }

    public boolean holds() {
        if (outcome == null) {
            throw new IllegalStateException("Evaluation has not finished");
        }
        return outcome;
    }

    public boolean isReached(int nodeId) {
        return reached[nodeId];
    }

    public Object valueOf(int nodeId) {
        return nodeValues[nodeId];
    }

    public boolean isRecorded(int slot) {
        return orderIndexes[slot] >= 0;
    }

    public int orderIndex(int slot) {
        return orderIndexes[slot];
    }

    public Object slotValue(int slot) {
        return slotValues[slot];
    }

    /**
     * Recorded slots in increasing order index.
     */
    public List<Integer> recordedSlots() {
        Integer[] bySlot = new Integer[nextOrderIndex];
        for (int slot = 0; slot < orderIndexes.length; slot++) {
            if (orderIndexes[slot] >= 0) {
                bySlot[orderIndexes[slot]] = slot;
            }
        }
        return new ArrayList<>(Arrays.asList(bySlot));
    }

    public SlotTable slots() {
        return slots;
    }
}
