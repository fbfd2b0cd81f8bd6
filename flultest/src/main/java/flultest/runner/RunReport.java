package flultest.runner;

import java.util.List;

/**
 * Immutable report of one run: the result of every executed test, in execution order.
 *
 * <p>A report is successful only if every result passed; an empty run is successful.
 *
 * @see Runner#execute()
 */
public final class RunReport {

    private final List<TestResult> results;
    private final long durationNanos;
    private final int passed;

    /**
     * Creates a report.
     *
     * @param results the individual results
     * @param durationNanos wall time of the whole run
     */
    public RunReport(List<TestResult> results, long durationNanos) {
        this.results = List.copyOf(results);
        this.durationNanos = durationNanos;
        this.passed = (int) this.results.stream().filter(TestResult::isPassed).count();
    }

    /** Returns the results, in execution order. */
    public List<TestResult> results() { return results; }

    public int total() { return results.size(); }

    public int passed() { return passed; }

    public int failed() { return results.size() - passed; }

    /** Returns true if no test failed. */
    public boolean success() { return passed == results.size(); }

    /** Returns the process exit code: 0 when every test passed, 1 otherwise. */
    public int exitCode() { return success() ? 0 : 1; }

    public long durationNanos() { return durationNanos; }

    /** Returns the summary line, e.g. {@code 3 tests, 2 passed, 1 failed}. */
    public String summary() {
        return total() + " tests, " + passed() + " passed, " + failed() + " failed";
    }
}
