package org.introspect.benchmark;

import java.io.OutputStream;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.introspect.AssertRewriter;
import org.introspect.RewriteResult;
import org.introspect.host.CollectingDiagnosticSink;
import org.introspect.recorder.EvaluationFrame;
import org.introspect.recorder.InstrumentedAssertion;
import org.introspect.report.AssertionReport;
import org.introspect.report.FailureReporter;
import org.introspect.report.ReportOptions;
import org.introspect.report.ReportState;
import org.introspect.runtime.SimulatedEnvironment;
import org.introspect.types.Declarations;
import org.openjdk.jmh.annotations.*;

/**
 * Run-time cost of an already rewritten assertion: the recording evaluation on
 * the passing path, and report construction on the failing one.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class WarmCheckBenchmark {

    @State(Scope.Thread)
    public static class CheckState {

        RewriteResult passing;
        InstrumentedAssertion failing;
        FailureReporter reporter;
        SimulatedEnvironment environment;

        @Setup(Level.Trial)
        public void rewrite() {
            Declarations declarations = Declarations.builder()
                    .variable("influence", "int")
                    .variable("atWar", "int")
                    .variable("stability", "int")
                    .build();
            ReportOptions options = ReportOptions.builder()
                    .out(OutputStream.nullOutputStream())
                    .colors(true)
                    .terminator((assertionText, reportText) -> { })
                    .build();
            AssertRewriter rewriter = AssertRewriter.builder()
                    .declarations(declarations)
                    .diagnostics(new CollectingDiagnosticSink())
                    .reportOptions(options)
                    .build();
            passing = rewriter.rewrite("influence >= 0 && !atWar || stability > 30");
            failing = rewriter.rewrite("influence > 100 || atWar && stability > 30").getAssertion().orElseThrow();
            reporter = new FailureReporter(options);
            environment = new SimulatedEnvironment();
        }

        @Setup(Level.Iteration)
        public void mutateEnvironment() {
            ThreadLocalRandom rng = ThreadLocalRandom.current();
            environment.set("influence", rng.nextInt(0, 100));
            environment.set("atWar", 0);
            environment.set("stability", rng.nextInt(0, 100));
        }
    }

    @Benchmark
    public ReportState passingCheck(CheckState state) {
        return state.passing.check(state.environment);
    }

    @Benchmark
    public AssertionReport failingReport(CheckState state) {
        EvaluationFrame frame = state.failing.evaluate(state.environment);
        return state.reporter.explain(state.failing, frame);
    }
}
