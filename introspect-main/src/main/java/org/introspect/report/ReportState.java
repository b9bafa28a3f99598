package org.introspect.report;

/**
 * Run-time phases of one checked assertion. A passing check goes from
 * {@link #EVALUATING} straight to {@link #DONE}; a failing one runs through
 * reporting and aborting until it is {@link #TERMINATED}.
 */
public enum ReportState {
    EVALUATING,
    DONE,
    REPORTING,
    ABORTING,
    TERMINATED
}
