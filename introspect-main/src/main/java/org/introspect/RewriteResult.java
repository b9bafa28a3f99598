package org.introspect;

import org.introspect.recorder.InstrumentedAssertion;
import org.introspect.report.FailureReporter;
import org.introspect.report.ReportState;
import org.introspect.runtime.RuntimeEnvironment;

import java.util.Optional;

/**
 * Outcome of rewriting one assertion occurrence: an instrumented assertion, or
 * nothing when the condition already carried an error.
 */
public final class RewriteResult {

    private final String sourceText;
    private final InstrumentedAssertion assertion;
    private final FailureReporter reporter;

    RewriteResult(String sourceText, InstrumentedAssertion assertion, FailureReporter reporter) {
        this.sourceText = sourceText;
        this.assertion = assertion;
        this.reporter = reporter;
    }

    public String getSourceText() {
        return sourceText;
    }

    public boolean isRewritten() {
        return assertion != null;
    }

    public Optional<InstrumentedAssertion> getAssertion() {
        return Optional.ofNullable(assertion);
    }

    /**
     * Checks the condition in {@code environment}, reporting and terminating on failure.
     *
     * @throws IllegalStateException if the occurrence was not rewritten
     */
    public ReportState check(RuntimeEnvironment environment) {
        if (assertion == null) {
            throw new IllegalStateException("'" + sourceText + "' was not rewritten");
        }
        return reporter.check(assertion, environment);
    }
}
