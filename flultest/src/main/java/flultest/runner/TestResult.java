package flultest.runner;

import flultest.expect.AssertionFailure;
import flultest.registry.TestMetadata;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of one test execution.
 *
 * <p>Use the static factories {@link #passed(TestMetadata, long)} and
 * {@link #failed(TestMetadata, long, TestOutcome, AssertionFailure)}.
 *
 * @see RunReport
 */
public final class TestResult {

    private final TestMetadata metadata;
    private final TestOutcome outcome;
    private final long durationNanos;
    private final AssertionFailure error;

    private TestResult(TestMetadata metadata, TestOutcome outcome, long durationNanos, AssertionFailure error) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.durationNanos = durationNanos;
        this.error = error;
    }

    /**
     * Creates a passing result.
     *
     * @param metadata the test that ran
     * @param durationNanos elapsed time
     * @return a passing result
     */
    public static TestResult passed(TestMetadata metadata, long durationNanos) {
        return new TestResult(metadata, TestOutcome.PASSED, durationNanos, null);
    }

    /**
     * Creates a failing result.
     *
     * @param metadata the test that ran
     * @param durationNanos elapsed time
     * @param outcome the failure kind, never {@link TestOutcome#PASSED}
     * @param error the failure to report
     * @return a failing result
     */
    public static TestResult failed(TestMetadata metadata, long durationNanos,
                                    TestOutcome outcome, AssertionFailure error) {
        if (!outcome.isFailure()) {
            throw new IllegalArgumentException("failed result requires a failure outcome, got " + outcome);
        }
        return new TestResult(metadata, outcome, durationNanos, Objects.requireNonNull(error, "error"));
    }

    public TestMetadata metadata() { return metadata; }

    public TestOutcome outcome() { return outcome; }

    /** Returns true if the test passed. */
    public boolean isPassed() { return outcome == TestOutcome.PASSED; }

    public long durationNanos() { return durationNanos; }

    public Duration duration() { return Duration.ofNanos(durationNanos); }

    /** Returns the failure, empty when the test passed. */
    public Optional<AssertionFailure> error() { return Optional.ofNullable(error); }

    @Override
    public String toString() {
        return metadata.identity() + " " + outcome + " (" + DurationFormat.format(durationNanos) + ")";
    }
}
