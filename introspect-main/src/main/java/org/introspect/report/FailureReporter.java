package org.introspect.report;

import org.introspect.format.ValueFormatter;
import org.introspect.recorder.EvaluationFrame;
import org.introspect.recorder.InstrumentedAssertion;
import org.introspect.runtime.RuntimeEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Runs an instrumented assertion and, when it fails, writes its report and
 * terminates.
 * <p>
 * The report goes out as a single write, flushed before the terminator runs, so
 * it is complete even when the terminator halts the process. A passing check
 * writes nothing.
 */
public class FailureReporter {

    private static final Logger LOG = LoggerFactory.getLogger(FailureReporter.class);

    private final ReportOptions options;
    private final ReportBuilder reportBuilder;

    public FailureReporter(ReportOptions options) {
        this.options = options;
        this.reportBuilder = new ReportBuilder(new ValueFormatter(), options.isColors() ? options.getPalette() : null);
    }

    /**
     * Evaluates the assertion in {@code environment}.
     *
     * @return {@link ReportState#DONE} when the condition holds; otherwise the
     * configured {@link Terminator} decides, and a terminator that returns
     * leaves the check {@link ReportState#TERMINATED}
     */
    public ReportState check(InstrumentedAssertion assertion, RuntimeEnvironment environment) {
        ReportState state = ReportState.EVALUATING;
        EvaluationFrame frame = assertion.evaluate(environment);
        if (frame.holds()) {
            state = transition(assertion, state, ReportState.DONE);
            return state;
        }

        state = transition(assertion, state, ReportState.REPORTING);
        AssertionReport report = reportBuilder.build(assertion, frame);
        String text = report.toText();
        PrintStream out = options.getOut();
        out.print(text);
        out.flush();

        state = transition(assertion, state, ReportState.ABORTING);
        try {
            options.getTerminator().terminate(assertion.getPrimitive() + "(" + assertion.getSourceText() + ")", text);
        } finally {
            transition(assertion, state, ReportState.TERMINATED);
        }
        return ReportState.TERMINATED;
    }

    /**
     * Builds the report of a failed evaluation without writing it.
     */
    public AssertionReport explain(InstrumentedAssertion assertion, EvaluationFrame frame) {
        if (frame.holds()) {
            throw new IllegalStateException("'" + assertion.getSourceText() + "' holds, nothing to explain");
        }
        return reportBuilder.build(assertion, frame);
    }

    private static ReportState transition(InstrumentedAssertion assertion, ReportState from, ReportState to) {
        LOG.debug("'{}': {} -> {}", assertion.getSourceText(), from, to);
        return to;
    }
}
