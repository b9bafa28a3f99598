package org.introspect.report;

import org.introspect.AssertionIntrospectionError;

/**
 * What happens once a failure report has been written and flushed.
 */
@FunctionalInterface
public interface Terminator {

    /**
     * Exit status of a process killed by SIGABRT.
     */
    int ABORT_STATUS = 134;

    /**
     * Throws {@link AssertionIntrospectionError} carrying the report.
     */
    Terminator THROW = (assertionText, reportText) -> {
        throw new AssertionIntrospectionError(assertionText, reportText);
    };

    /**
     * Halts the JVM immediately with {@link #ABORT_STATUS}, without shutdown hooks.
     */
    Terminator HALT = (assertionText, reportText) -> Runtime.getRuntime().halt(ABORT_STATUS);

    /**
     * Must not return normally.
     */
    void terminate(String assertionText, String reportText);
}
