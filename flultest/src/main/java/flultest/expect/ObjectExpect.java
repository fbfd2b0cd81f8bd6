package flultest.expect;

/**
 * Expectation over a value that only supports equality.
 *
 * @param <T> the type of the value under test
 */
public final class ObjectExpect<T> extends AbstractExpect<ObjectExpect<T>, T> {

    public ObjectExpect(T actual) {
        this(actual, SourceLocation.current());
    }

    public ObjectExpect(T actual, SourceLocation location) {
        super(actual, location);
    }
}
