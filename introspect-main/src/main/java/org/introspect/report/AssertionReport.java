package org.introspect.report;

import org.introspect.recorder.EvaluationRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * The explanation of one failed assertion, line by line.
 *
 * @param sourceLine        {@code > assert(<condition as written>)}
 * @param symbolicLine      {@code A assert(<symbolic form>)}
 * @param evaluatedLine     {@code E assert(<evaluated form>)}
 * @param subexpressionLines one {@code   <text> = <value>} line per listed record
 * @param records           the listed records, in evaluation order
 */
public record AssertionReport(String sourceLine,
                              String symbolicLine,
                              String evaluatedLine,
                              List<String> subexpressionLines,
                              List<EvaluationRecord> records) {

    public static final String SUBEXPRESSIONS_HEADER = "> subexpressions:";

    public AssertionReport {
        subexpressionLines = List.copyOf(subexpressionLines);
        records = List.copyOf(records);
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        lines.add(sourceLine);
        lines.add(symbolicLine);
        lines.add(evaluatedLine);
        lines.add(SUBEXPRESSIONS_HEADER);
        lines.addAll(subexpressionLines);
        return lines;
    }

    /**
     * The whole report, every line newline-terminated.
     */
    public String toText() {
        StringBuilder text = new StringBuilder();
        for (String line : lines()) {
            text.append(line).append('\n');
        }
        return text.toString();
    }
}
