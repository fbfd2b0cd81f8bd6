package flultest.expect;

import java.util.Objects;

/**
 * Base of the fluent expectations: holds the value under test and the call site.
 *
 * <p>Every check returns {@code SELF}, the concrete expectation type, so checks can be
 * chained. A failed check throws {@link AssertionFailure} and thereby ends the chain.
 *
 * @param <SELF> the concrete expectation type
 * @param <T> the type of the value under test
 */
public abstract class AbstractExpect<SELF extends AbstractExpect<SELF, T>, T> {

    protected final T actual;
    protected final SourceLocation location;
    private final SELF self;

    @SuppressWarnings("unchecked")
    protected AbstractExpect(T actual, SourceLocation location) {
        this.actual = actual;
        this.location = Objects.requireNonNull(location, "location");
        this.self = (SELF) this;
    }

    /**
     * Requires the value to equal {@code expected}. Arrays are compared element-wise.
     *
     * @param expected the required value
     * @return this expectation
     * @throws AssertionFailure if the values differ
     */
    public SELF toEqual(T expected) {
        if (!Objects.deepEquals(actual, expected)) {
            throw failure(Stringify.stringify(expected));
        }
        return self;
    }

    /**
     * Requires the value to differ from {@code unexpected}.
     *
     * @param unexpected the forbidden value
     * @return this expectation
     * @throws AssertionFailure if the values are equal
     */
    public SELF toNotEqual(T unexpected) {
        if (Objects.deepEquals(actual, unexpected)) {
            throw failure("not " + Stringify.stringify(unexpected));
        }
        return self;
    }

    /** Returns the value under test. */
    public T actual() {
        return actual;
    }

    /** Returns where this expectation was created. */
    public SourceLocation location() {
        return location;
    }

    protected SELF self() {
        return self;
    }

    protected AssertionFailure failure(String expectedText) {
        return new AssertionFailure(Stringify.stringify(actual), expectedText, location);
    }
}
