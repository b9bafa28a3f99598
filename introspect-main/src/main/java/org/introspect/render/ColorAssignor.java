package org.introspect.render;

import org.introspect.ir.Call;
import org.introspect.ir.ExpressionNode;
import org.introspect.recorder.EvaluationRecord;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gives each record a palette color, walking the records in evaluation order and
 * cycling through the palette. Calls are recorded after their arguments, so a call
 * skips any color already bound to one of its direct arguments.
 */
public class ColorAssignor {

    private final int paletteSize;

    public ColorAssignor(int paletteSize) {
        this.paletteSize = paletteSize;
    }

    /**
     * @param records the records to color, in increasing order index
     */
    public ColorTable assign(ExpressionNode root, List<EvaluationRecord> records) {
        Map<Integer, Call> calls = new HashMap<>();
        indexCalls(root, calls);

        Map<Integer, Integer> colors = new LinkedHashMap<>();
        int cursor = 0;
        for (EvaluationRecord record : records) {
            int nodeId = record.nodeId();
            if (colors.containsKey(nodeId)) {
                continue;
            }
            Set<Integer> excluded = new HashSet<>();
            Call call = calls.get(nodeId);
            if (call != null) {
                for (ExpressionNode argument : call.getArguments()) {
                    if (colors.containsKey(argument.getId())) {
                        excluded.add(colors.get(argument.getId()));
                    }
                }
            }
            int color = cursor;
            for (int attempt = 0; attempt < paletteSize; attempt++) {
                int candidate = (cursor + attempt) % paletteSize;
                if (!excluded.contains(candidate)) {
                    color = candidate;
                    break;
                }
            }
            colors.put(nodeId, color);
            cursor = (color + 1) % paletteSize;
        }
        return new ColorTable(colors);
    }

    private static void indexCalls(ExpressionNode node, Map<Integer, Call> calls) {
        if (node instanceof Call) {
            calls.put(node.getId(), (Call) node);
        }
        for (ExpressionNode child : node.getChildren()) {
            indexCalls(child, calls);
        }
    }
}
