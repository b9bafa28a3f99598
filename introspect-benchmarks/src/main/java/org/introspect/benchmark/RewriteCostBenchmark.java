package org.introspect.benchmark;

import java.util.concurrent.TimeUnit;

import org.introspect.AssertRewriter;
import org.introspect.RewriteResult;
import org.introspect.host.CollectingDiagnosticSink;
import org.introspect.report.ReportOptions;
import org.introspect.types.Declarations;
import org.openjdk.jmh.annotations.*;

/**
 * Build-time cost of rewriting one assertion occurrence: parse, type check,
 * classify and instrument.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
@State(Scope.Benchmark)
public class RewriteCostBenchmark {

    private AssertRewriter rewriter;

    @Setup(Level.Trial)
    public void setup() {
        Declarations declarations = Declarations.builder()
                .variable("n", "int")
                .variable("m", "int")
                .variable("s", "const char *")
                .variable("len", "size_t")
                .function("strlen", "size_t", "const char *")
                .function("strstr", "char *", "const char *", "const char *")
                .build();
        rewriter = AssertRewriter.builder()
                .declarations(declarations)
                .diagnostics(new CollectingDiagnosticSink())
                .reportOptions(ReportOptions.builder().build())
                .build();
    }

    @Benchmark
    public RewriteResult simpleComparison() {
        return rewriter.rewrite("n == 5");
    }

    @Benchmark
    public RewriteResult logicalChain() {
        return rewriter.rewrite("n == 42 && m == 7 || n + m > 10 && (n - 1) * m != 0");
    }

    @Benchmark
    public RewriteResult nestedCalls() {
        return rewriter.rewrite("strlen(strstr(\"hello world\", s)) == len");
    }
}
