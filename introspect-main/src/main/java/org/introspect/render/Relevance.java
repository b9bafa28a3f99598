package org.introspect.render;

import org.introspect.ir.ExpressionNode;
import org.introspect.ir.LogicalAnd;
import org.introspect.ir.LogicalOr;
import org.introspect.recorder.EvaluationFrame;
import org.introspect.runtime.Values;

/**
 * Decides which reached nodes a failure report shows.
 * <p>
 * Unreached nodes are never shown. Along the failure path, that is through
 * the {@code &&} and {@code ||} nodes whose falseness made the condition fail,
 * a left operand of {@code &&} that evaluated true did not contribute and is
 * hidden as well. Everything reached outside that path is shown.
 */
public final class Relevance {

    private final boolean[] shown;

    private Relevance(int nodeCount) {
        this.shown = new boolean[nodeCount];
    }

    public static Relevance analyze(ExpressionNode root, EvaluationFrame frame) {
        Relevance relevance = new Relevance(frame.slots().nodeCount());
        relevance.mark(root, frame, true);
        return relevance;
    }

    public boolean isShown(int nodeId) {
        return nodeId < shown.length && shown[nodeId];
    }

    private void mark(ExpressionNode node, EvaluationFrame frame, boolean failurePath) {
        if (!frame.isReached(node.getId())) {
            return;
        }
        shown[node.getId()] = true;
        if (failurePath && node instanceof LogicalAnd) {
            LogicalAnd and = (LogicalAnd) node;
            if (Values.isTrue(frame.valueOf(and.getLeft().getId()))) {
                mark(and.getRight(), frame, true);
            } else {
                mark(and.getLeft(), frame, true);
            }
            return;
        }
        if (failurePath && node instanceof LogicalOr) {
            LogicalOr or = (LogicalOr) node;
            mark(or.getLeft(), frame, true);
            mark(or.getRight(), frame, true);
            return;
        }
        for (ExpressionNode child : node.getChildren()) {
            mark(child, frame, false);
        }
    }
}
