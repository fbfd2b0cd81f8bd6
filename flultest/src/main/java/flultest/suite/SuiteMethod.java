package flultest.suite;

/**
 * A test body bound to a suite type, usually an unbound method reference such as
 * {@code StackSuite::pushThenPop}.
 *
 * @param <S> the suite type
 */
@FunctionalInterface
public interface SuiteMethod<S extends Suite> {

    void run(S suite) throws Throwable;
}
