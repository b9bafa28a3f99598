package org.introspect.host;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        synchronized (diagnostics) {
            return List.copyOf(diagnostics);
        }
    }

    public boolean hasErrors() {
        return getDiagnostics().stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }
}
