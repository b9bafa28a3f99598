package org.introspect.host;

/**
 * The host's diagnostic-reporting facility.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(Diagnostic diagnostic);

    default void error(String message, String sourceText) {
        report(new Diagnostic(Diagnostic.Severity.ERROR, message, sourceText));
    }

    default void warning(String message, String sourceText) {
        report(new Diagnostic(Diagnostic.Severity.WARNING, message, sourceText));
    }
}
