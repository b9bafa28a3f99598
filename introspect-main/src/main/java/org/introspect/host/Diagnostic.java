package org.introspect.host;

public record Diagnostic(Severity severity, String message, String sourceText) {

    public enum Severity {
        NOTE,
        WARNING,
        ERROR
    }

    @Override
    public String toString() {
        return severity.name().toLowerCase() + ": " + message + " [" + sourceText + "]";
    }
}
