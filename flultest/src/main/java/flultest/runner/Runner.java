package flultest.runner;

import flultest.alert.RunEventLogger;
import flultest.expect.AssertionFailure;
import flultest.expect.SourceLocation;
import flultest.expect.Stringify;
import flultest.registry.Registry;
import flultest.registry.TestEntry;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Executes every test retained by a {@link Registry}, sequentially, in registration order.
 *
 * <p>Each test is isolated: whatever it throws is converted into a failed
 * {@link TestResult} and the run continues.
 * <ul>
 *   <li>{@link AssertionFailure} - reported as is</li>
 *   <li>any other {@link Exception} - {@code threw: <message>}</li>
 *   <li>any other {@link Throwable} - {@code unknown exception}</li>
 * </ul>
 * Synthesized failures point at the runner's catch site and keep the original
 * throwable as their cause.
 *
 * <h2>Output:</h2>
 * <pre>
 * [ PASS ] MathSuite::adds (1.52µs)
 * [ FAIL ] MathSuite::divides (12.04µs)
 *   MathSuite.java:31: assertion failed
 *
 * 2 tests, 1 passed, 1 failed
 * </pre>
 *
 * <p>The registry is snapshotted when a run starts. There is no timeout: a test that
 * never returns blocks the run.
 *
 * @see RunReport
 */
public class Runner {

    private final Registry registry;
    private final PrintStream out;

    /** Creates a runner printing UTF-8 on {@code System.out}. */
    public Runner(Registry registry) {
        this(registry, utf8(System.out));
    }

    /**
     * Creates a runner.
     *
     * @param registry the tests to run
     * @param out destination of per-test lines and the summary
     */
    public Runner(Registry registry, PrintStream out) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Runs all tests and prints their results.
     *
     * @return 0 if every test passed (or none ran), 1 otherwise
     */
    public int runAll() {
        return execute().exitCode();
    }

    /**
     * Runs all tests, prints their results, and returns the full report.
     *
     * @return the report of this run
     */
    public RunReport execute() {
        List<TestEntry> tests = List.copyOf(registry.tests());
        RunEventLogger.runStarted(tests.size());

        long runStart = System.nanoTime();
        List<TestResult> results = new ArrayList<>(tests.size());
        for (TestEntry entry : tests) {
            TestResult result = runTest(entry);
            if (result.isPassed()) {
                RunEventLogger.testPassed(result);
            } else {
                RunEventLogger.testFailed(result);
            }
            printResult(result);
            results.add(result);
        }

        RunReport report = new RunReport(results, System.nanoTime() - runStart);
        printSummary(report);
        RunEventLogger.runCompleted(report);
        return report;
    }

    /**
     * Runs a single entry and classifies how it ended.
     *
     * @param entry the test to run
     * @return its result; never throws
     */
    public static TestResult runTest(TestEntry entry) {
        long start = System.nanoTime();
        try {
            entry.invoke();
            return TestResult.passed(entry.metadata(), System.nanoTime() - start);
        } catch (AssertionFailure e) {
            return TestResult.failed(entry.metadata(), System.nanoTime() - start,
                    TestOutcome.ASSERTION_FAILURE, e);
        } catch (Exception e) {
            long elapsed = System.nanoTime() - start;
            AssertionFailure error = new AssertionFailure(
                    "threw: " + Stringify.messageOf(e), "no exception", SourceLocation.current(), e);
            return TestResult.failed(entry.metadata(), elapsed, TestOutcome.FOREIGN_FAILURE, error);
        } catch (Throwable t) {
            long elapsed = System.nanoTime() - start;
            AssertionFailure error = new AssertionFailure(
                    "unknown exception", "no exception", SourceLocation.current(), t);
            return TestResult.failed(entry.metadata(), elapsed, TestOutcome.UNKNOWN_FAILURE, error);
        }
    }

    /**
     * Wraps a console stream so that text is encoded as UTF-8 whatever the platform
     * charset is. Durations contain {@code µ}.
     *
     * @param stream the stream to write to
     * @return an autoflushing UTF-8 stream over {@code stream}
     */
    public static PrintStream utf8(PrintStream stream) {
        return new PrintStream(stream, true, StandardCharsets.UTF_8);
    }

    private void printResult(TestResult result) {
        out.println(String.format(Locale.ROOT, "[ %s ] %s (%s)",
                result.isPassed() ? "PASS" : "FAIL",
                result.metadata().identity(),
                DurationFormat.format(result.durationNanos())));
        result.error().ifPresent(e -> out.println("  " + e.getMessage()));
    }

    private void printSummary(RunReport report) {
        out.println();
        out.println(report.summary());
        out.flush();
    }
}
