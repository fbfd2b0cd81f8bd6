package flultest.expect;

import java.util.Objects;

/**
 * Structured failure raised by a failed expectation.
 *
 * <p>Carries the textual form of the actual and expected values plus the location of
 * the check. The human-readable message is formatted once, at construction:
 * <pre>
 * CalculatorSuite.java:42: assertion failed
 *   expected: 4
 *     actual: 5
 * </pre>
 *
 * <p>The runner also synthesizes instances of this type when a test throws something
 * else; in that case the original throwable is kept as the cause.
 *
 * @see Expect
 * @see flultest.runner.Runner
 */
public class AssertionFailure extends RuntimeException {

    private final String actual;
    private final String expected;
    private final SourceLocation location;

    /**
     * Creates a failure without a cause.
     *
     * @param actual textual form of the observed value
     * @param expected textual form of what was required
     * @param location where the check was made
     */
    public AssertionFailure(String actual, String expected, SourceLocation location) {
        this(actual, expected, location, null);
    }

    /**
     * Creates a failure that wraps the throwable which produced it.
     *
     * @param actual textual form of the observed value
     * @param expected textual form of what was required
     * @param location where the check was made
     * @param cause the throwable behind the failure (may be null)
     */
    public AssertionFailure(String actual, String expected, SourceLocation location, Throwable cause) {
        super(format(actual, expected, location), cause);
        this.actual = Objects.requireNonNull(actual, "actual");
        this.expected = Objects.requireNonNull(expected, "expected");
        this.location = Objects.requireNonNull(location, "location");
    }

    private static String format(String actual, String expected, SourceLocation location) {
        return (location != null ? location : SourceLocation.UNKNOWN)
                + ": assertion failed\n  expected: " + expected + "\n    actual: " + actual;
    }

    /** Returns the textual form of the observed value. */
    public String actual() { return actual; }

    /** Returns the textual form of the required value. */
    public String expected() { return expected; }

    /** Returns where the failing check was made. */
    public SourceLocation location() { return location; }
}
