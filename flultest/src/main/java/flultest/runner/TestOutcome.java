package flultest.runner;

/**
 * How a single test ended.
 *
 * <p>Every outcome other than {@link #PASSED} is a failure and carries an
 * {@link flultest.expect.AssertionFailure}: the original one for
 * {@link #ASSERTION_FAILURE}, a synthesized one otherwise.
 */
public enum TestOutcome {

    /** The test completed normally. */
    PASSED,

    /** An expectation failed. */
    ASSERTION_FAILURE,

    /** The test threw an {@link Exception} that is not an expectation failure. */
    FOREIGN_FAILURE,

    /** The test threw a {@link Throwable} outside the {@link Exception} family. */
    UNKNOWN_FAILURE;

    public boolean isFailure() {
        return this != PASSED;
    }
}
