package flultest.expect;

/**
 * Expectation over a boolean condition.
 *
 * <p>A null {@code Boolean} is neither true nor false and fails both checks.
 */
public final class BooleanExpect extends AbstractExpect<BooleanExpect, Boolean> {

    public BooleanExpect(Boolean actual) {
        this(actual, SourceLocation.current());
    }

    public BooleanExpect(Boolean actual, SourceLocation location) {
        super(actual, location);
    }

    /**
     * Requires the condition to hold.
     *
     * @return this expectation
     * @throws AssertionFailure if the value is false or null
     */
    public BooleanExpect toBeTrue() {
        if (!Boolean.TRUE.equals(actual)) {
            throw failure("true");
        }
        return this;
    }

    /**
     * Requires the condition not to hold.
     *
     * @return this expectation
     * @throws AssertionFailure if the value is true or null
     */
    public BooleanExpect toBeFalse() {
        if (!Boolean.FALSE.equals(actual)) {
            throw failure("false");
        }
        return this;
    }
}
