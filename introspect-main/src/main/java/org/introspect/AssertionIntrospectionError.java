package org.introspect;

/**
 * Raised by the default terminator once a failed assertion has been reported.
 * It stands in for the abnormal termination of the assertion primitive, so it is
 * an {@link AssertionError} and not an {@link IntrospectException}.
 */
public class AssertionIntrospectionError extends AssertionError {

    private final String report;

    public AssertionIntrospectionError(String assertionText, String report) {
        super("Assertion failed: " + assertionText);
        this.report = report;
    }

    /**
     * The full report text as it was written to the output stream.
     */
    public String getReport() {
        return report;
    }
}
