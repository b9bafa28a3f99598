package org.introspect.recorder;

/**
 * What one reached leaf looked like at run time.
 *
 * @param nodeId     identity of the evaluated node
 * @param text       symbolic rendering of the node, without colors
 * @param orderIndex position in evaluation order
 * @param valueText  the formatted value
 * @param colorId    palette index, or {@link #NO_COLOR}
 */
public record EvaluationRecord(int nodeId, String text, int orderIndex, String valueText, int colorId) {

    public static final int NO_COLOR = -1;

    public EvaluationRecord withColor(int color) {
        return new EvaluationRecord(nodeId, text, orderIndex, valueText, color);
    }

    public boolean hasColor() {
        return colorId != NO_COLOR;
    }
}
