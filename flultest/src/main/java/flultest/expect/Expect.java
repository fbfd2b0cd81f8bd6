package flultest.expect;

/**
 * Entry points of the fluent expectation DSL.
 *
 * <p>The overload picked depends on what the value supports:
 * <ul>
 *   <li>{@code Boolean} / {@code boolean} - {@link BooleanExpect}</li>
 *   <li>{@link Comparable} - {@link ComparableExpect}, with ordering checks</li>
 *   <li>anything else - {@link ObjectExpect}, equality only</li>
 * </ul>
 *
 * <h2>Example:</h2>
 * <pre>
 * import static flultest.expect.Expect.expect;
 *
 * expect(calculator.add(2, 2)).toEqual(4).toBeGreaterThan(3);
 * expect(stack.isEmpty()).toBeTrue();
 * </pre>
 *
 * <p>The call site is recorded automatically and reported on failure.
 */
public final class Expect {

    private Expect() {}

    public static BooleanExpect expect(Boolean actual) {
        return new BooleanExpect(actual, SourceLocation.current());
    }

    public static <T extends Comparable<? super T>> ComparableExpect<T> expect(T actual) {
        return new ComparableExpect<>(actual, SourceLocation.current());
    }

    public static <T> ObjectExpect<T> expect(T actual) {
        return new ObjectExpect<>(actual, SourceLocation.current());
    }

    public static ExpectCallable expectCallable(ThrowingRunnable callable) {
        return new ExpectCallable(callable, SourceLocation.current());
    }
}
