package org.introspect;

import org.introspect.host.CollectingDiagnosticSink;
import org.introspect.host.Diagnostic;
import org.introspect.host.TreeCode;
import org.introspect.host.TypedExpression;
import org.introspect.ir.ExpressionClassifier;
import org.introspect.report.ReportOptions;
import org.introspect.report.ReportState;
import org.introspect.runtime.SimulatedEnvironment;
import org.introspect.types.CType;
import org.introspect.types.Declarations;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssertRewriterTest {

    private final CollectingDiagnosticSink diagnostics = new CollectingDiagnosticSink();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private AssertRewriter rewriter(Declarations declarations) {
        return AssertRewriter.builder()
                .declarations(declarations)
                .diagnostics(diagnostics)
                .reportOptions(ReportOptions.builder().out(out).terminator((text, report) -> { }).build())
                .build();
    }

    @Test
    void undeclaredName_skipsRewriteWithPreviousErrorDiagnostic() {
        RewriteResult result = rewriter(Declarations.empty()).rewrite("missing == 1");

        assertThat(result.isRewritten()).isFalse();
        assertThat(result.getAssertion()).isEmpty();
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::message)
                .containsExactly("'missing' undeclared", ExpressionClassifier.PREVIOUS_ERROR_MESSAGE);
        assertThat(diagnostics.getDiagnostics()).allMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    @Test
    void hostErrorNode_isReportedOnce() {
        TypedExpression condition = TypedExpression.binary(TreeCode.EQ, CType.INT,
                TypedExpression.error("bogus"), TypedExpression.integer(1));

        RewriteResult result = rewriter(Declarations.empty()).rewrite(condition);

        assertThat(result.isRewritten()).isFalse();
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        assertThat(diagnostics.getDiagnostics().get(0).message())
                .contains("assertion rewriting skipped: previous error in expression");
    }

    @Test
    void skippedRewrite_cannotBeChecked() {
        RewriteResult result = rewriter(Declarations.empty()).rewrite("missing == 1");

        assertThatThrownBy(() -> result.check(new SimulatedEnvironment()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing == 1");
    }

    @Test
    void customPrimitive_appearsInEveryReportLine() {
        AssertRewriter rewriter = AssertRewriter.builder()
                .declarations(Declarations.builder().variable("n", "int").build())
                .diagnostics(diagnostics)
                .primitive("g_assert")
                .reportOptions(ReportOptions.builder().out(out).terminator((text, report) -> { }).build())
                .build();

        rewriter.rewrite("n == 1").check(new SimulatedEnvironment().set("n", 2));

        assertThat(out.toString(StandardCharsets.UTF_8))
                .startsWith("> g_assert(n == 1)\nA g_assert(n == 1)\nE g_assert(2 == 1)\n");
    }

    @Test
    void rewrittenAssertion_isSharedSafelyAcrossThreads() throws Exception {
        RewriteResult result = rewriter(Declarations.builder().variable("n", "int").build()).rewrite("n < 100");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<ReportState>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                long value = i;
                tasks.add(() -> result.check(new SimulatedEnvironment().set("n", value)));
            }
            for (Future<ReportState> future : pool.invokeAll(tasks)) {
                assertThat(future.get()).isEqualTo(ReportState.DONE);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(out.size()).isZero();
    }
}
