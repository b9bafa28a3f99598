package org.introspect.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Surfaces diagnostics through SLF4J. Used when no host sink is configured.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    @Override
    public void report(Diagnostic diagnostic) {
        switch (diagnostic.severity()) {
            case ERROR -> LOG.error("{} [{}]", diagnostic.message(), diagnostic.sourceText());
            case WARNING -> LOG.warn("{} [{}]", diagnostic.message(), diagnostic.sourceText());
            case NOTE -> LOG.info("{} [{}]", diagnostic.message(), diagnostic.sourceText());
        }
    }
}
