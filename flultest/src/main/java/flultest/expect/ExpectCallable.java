package flultest.expect;

import java.util.Objects;

/**
 * Expectation over the exceptions raised by a code block.
 *
 * <p>The block is invoked once per check.
 *
 * <h2>Example:</h2>
 * <pre>
 * IllegalArgumentException e = Expect.expectCallable(() -&gt; calculator.divide(1, 0))
 *         .toThrow(IllegalArgumentException.class);
 *
 * Expect.expectCallable(() -&gt; calculator.divide(4, 2)).toNotThrow();
 * </pre>
 */
public final class ExpectCallable {

    private final ThrowingRunnable callable;
    private final SourceLocation location;

    public ExpectCallable(ThrowingRunnable callable) {
        this(callable, SourceLocation.current());
    }

    public ExpectCallable(ThrowingRunnable callable, SourceLocation location) {
        this.callable = Objects.requireNonNull(callable, "callable");
        this.location = Objects.requireNonNull(location, "location");
    }

    /**
     * Requires the block to throw an instance of {@code type}.
     *
     * @param type the required throwable type; subclasses match
     * @param <E> the required throwable type
     * @return the caught throwable, for further checks
     * @throws AssertionFailure with actual {@code "different exception"} if something
     *         else was thrown, or {@code "no exception"} if the block completed normally
     */
    public <E extends Throwable> E toThrow(Class<E> type) {
        Objects.requireNonNull(type, "type");
        try {
            callable.run();
        } catch (Throwable t) {
            if (type.isInstance(t)) {
                return type.cast(t);
            }
            throw new AssertionFailure("different exception", Stringify.typeName(type), location, t);
        }
        throw new AssertionFailure("no exception", Stringify.typeName(type), location);
    }

    /**
     * Requires the block to complete normally.
     *
     * @throws AssertionFailure carrying the thrown exception's message, or
     *         {@code "unknown exception"} for a throwable outside the {@link Exception} family
     */
    public void toNotThrow() {
        try {
            callable.run();
        } catch (Exception e) {
            throw new AssertionFailure(Stringify.messageOf(e), "no exception", location, e);
        } catch (Throwable t) {
            throw new AssertionFailure("unknown exception", "no exception", location, t);
        }
    }

    /** Returns where this expectation was created. */
    public SourceLocation location() {
        return location;
    }
}
