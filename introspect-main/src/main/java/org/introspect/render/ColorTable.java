package org.introspect.render;

import org.introspect.recorder.EvaluationRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node id to palette color, for one failure report.
 */
public final class ColorTable {

    private final Map<Integer, Integer> colors;

    ColorTable(Map<Integer, Integer> colors) {
        this.colors = Collections.unmodifiableMap(new LinkedHashMap<>(colors));
    }

    public static ColorTable empty() {
        return new ColorTable(Map.of());
    }

    public int colorOf(int nodeId) {
        return colors.getOrDefault(nodeId, EvaluationRecord.NO_COLOR);
    }

    public boolean hasColor(int nodeId) {
        return colors.containsKey(nodeId);
    }

    public int size() {
        return colors.size();
    }
}
