package flultest.registry;

/**
 * Runs one test to completion, fixture included.
 */
@FunctionalInterface
public interface TestInvocation {

    void invoke() throws Throwable;
}
