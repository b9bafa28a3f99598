package org.introspect;

import org.introspect.host.DiagnosticSink;
import org.introspect.host.JavaParserFrontEnd;
import org.introspect.host.LoggingDiagnosticSink;
import org.introspect.host.TypedExpression;
import org.introspect.ir.ExpressionClassifier;
import org.introspect.ir.ExpressionNode;
import org.introspect.recorder.EvaluationRecorder;
import org.introspect.report.FailureReporter;
import org.introspect.report.ReportOptions;
import org.introspect.types.Declarations;

import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites assertion occurrences into instrumented assertions.
 * <pre>{@code
 * AssertRewriter rewriter = AssertRewriter.builder()
 *         .declarations(Declarations.builder().variable("n", "int").build())
 *         .build();
 * rewriter.rewrite("n == 5").check(environment);
 * }</pre>
 * Instances are immutable and may rewrite occurrences from several threads.
 */
public final class AssertRewriter {

    private final Declarations declarations;
    private final DiagnosticSink diagnostics;
    private final String primitive;
    private final JavaParserFrontEnd frontEnd;
    private final ExpressionClassifier classifier = new ExpressionClassifier();
    private final EvaluationRecorder recorder = new EvaluationRecorder();
    private final FailureReporter reporter;

    private AssertRewriter(Builder builder) {
        this.declarations = builder.declarations;
        this.diagnostics = builder.diagnostics;
        this.primitive = builder.primitive;
        this.frontEnd = new JavaParserFrontEnd(declarations);
        this.reporter = new FailureReporter(builder.reportOptions != null ? builder.reportOptions : ReportOptions.defaults());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses and type-checks {@code condition} against the declarations, then rewrites it.
     */
    public RewriteResult rewrite(String condition) {
        return rewrite(frontEnd.parse(condition, diagnostics));
    }

    /**
     * Rewrites a condition some other front end has already typed.
     */
    public RewriteResult rewrite(TypedExpression condition) {
        String sourceText = condition.getSourceText();
        Optional<ExpressionNode> root = classifier.classify(condition, diagnostics);
        if (root.isEmpty()) {
            return new RewriteResult(sourceText, null, reporter);
        }
        return new RewriteResult(sourceText, recorder.rewrite(primitive, sourceText, root.get()), reporter);
    }

    public Declarations getDeclarations() {
        return declarations;
    }

    public String getPrimitive() {
        return primitive;
    }

    public static final class Builder {

        private Declarations declarations = Declarations.empty();
        private DiagnosticSink diagnostics = new LoggingDiagnosticSink();
        private String primitive = "assert";
        private ReportOptions reportOptions;

        private Builder() {
        }

        public Builder declarations(Declarations declarations) {
            this.declarations = Objects.requireNonNull(declarations, "declarations");
            return this;
        }

        public Builder diagnostics(DiagnosticSink diagnostics) {
            this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
            return this;
        }

        public Builder primitive(String primitive) {
            this.primitive = Objects.requireNonNull(primitive, "primitive");
            return this;
        }

        public Builder reportOptions(ReportOptions reportOptions) {
            this.reportOptions = Objects.requireNonNull(reportOptions, "reportOptions");
            return this;
        }

        public AssertRewriter build() {
            return new AssertRewriter(this);
        }
    }
}
