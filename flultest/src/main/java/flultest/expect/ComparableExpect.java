package flultest.expect;

/**
 * Expectation over a totally ordered value: equality plus strict bounds.
 *
 * <p>A null value fails every bound check.
 *
 * @param <T> the type of the value under test
 */
public final class ComparableExpect<T extends Comparable<? super T>>
        extends AbstractExpect<ComparableExpect<T>, T> {

    public ComparableExpect(T actual) {
        this(actual, SourceLocation.current());
    }

    public ComparableExpect(T actual, SourceLocation location) {
        super(actual, location);
    }

    /**
     * Requires the value to be strictly greater than {@code bound}.
     *
     * @param bound the exclusive lower bound
     * @return this expectation
     * @throws AssertionFailure if {@code actual <= bound}
     */
    public ComparableExpect<T> toBeGreaterThan(T bound) {
        if (actual == null || bound == null || actual.compareTo(bound) <= 0) {
            throw failure("greater than " + Stringify.stringify(bound));
        }
        return self();
    }

    /**
     * Requires the value to be strictly less than {@code bound}.
     *
     * @param bound the exclusive upper bound
     * @return this expectation
     * @throws AssertionFailure if {@code actual >= bound}
     */
    public ComparableExpect<T> toBeLessThan(T bound) {
        if (actual == null || bound == null || actual.compareTo(bound) >= 0) {
            throw failure("less than " + Stringify.stringify(bound));
        }
        return self();
    }
}
