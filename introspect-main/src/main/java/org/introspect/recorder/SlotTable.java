package org.introspect.recorder;

import org.introspect.ir.ExpressionNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tracks node id to hidden storage slot mappings for one instrumented assertion.
 * <p>
 * Only leaves get a slot, in the order the rewrite reaches them, which is the
 * original evaluation order. Each node has at most one slot no matter how many
 * times its value is displayed.
 */
public final class SlotTable {

    private final int[] slotsByNodeId;
    private final List<ExpressionNode> nodesBySlot = new ArrayList<>();

    /**
     * @param nodeCount number of node ids in the tree
     */
    public SlotTable(int nodeCount) {
        this.slotsByNodeId = new int[nodeCount];
        Arrays.fill(slotsByNodeId, -1);
    }

    /**
     * Allocate the slot for a leaf.
     *
     * @return the allocated slot index
     * @throws IllegalArgumentException if the node already has a slot
     */
    public int allocate(ExpressionNode node) {
        if (slotsByNodeId[node.getId()] >= 0) {
            throw new IllegalArgumentException("Node " + node.getId() + " already has a slot");
        }
        int slot = nodesBySlot.size();
        nodesBySlot.add(node);
        slotsByNodeId[node.getId()] = slot;
        return slot;
    }

    /**
     * Look up the slot for a node id.
     *
     * @throws IllegalArgumentException if the node has no slot
     */
    public int slot(int nodeId) {
        int slot = nodeId < slotsByNodeId.length ? slotsByNodeId[nodeId] : -1;
        if (slot < 0) {
            throw new IllegalArgumentException("No slot for node " + nodeId);
        }
        return slot;
    }

    public boolean contains(int nodeId) {
        return nodeId < slotsByNodeId.length && slotsByNodeId[nodeId] >= 0;
    }

    public ExpressionNode node(int slot) {
        return nodesBySlot.get(slot);
    }

    public int size() {
        return nodesBySlot.size();
    }

    public int nodeCount() {
        return slotsByNodeId.length;
    }
}
