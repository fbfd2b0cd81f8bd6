package flultest.suite;

import flultest.alert.RunEventLogger;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs one test body inside its fixture: construct, set up, run, tear down.
 *
 * <p>Teardown runs on every exit path once the suite has been constructed. When the
 * body (or setUp) fails and teardown fails as well, the first failure is rethrown and
 * the teardown failure is attached to it as suppressed, then logged. A teardown that
 * rethrows the very same throwable leaves it unchanged.
 */
public final class FixtureInvocation {

    private FixtureInvocation() {}

    /**
     * Invokes a single test on a fresh suite instance.
     *
     * @param testId the {@code suite::test} identity, for diagnostics
     * @param factory creates the suite instance
     * @param method the test body
     * @param <S> the suite type
     * @throws Throwable the first failure raised by setUp, the body or tearDown
     */
    public static <S extends Suite> void invoke(String testId, Supplier<S> factory, SuiteMethod<S> method)
            throws Throwable {
        S suite = Objects.requireNonNull(factory.get(), "suite factory returned null for " + testId);

        Throwable failure = null;
        try {
            suite.setUp();
            method.run(suite);
        } catch (Throwable t) {
            failure = t;
        }

        try {
            suite.tearDown();
        } catch (Throwable t) {
            if (failure == null) {
                failure = t;
            } else if (t != failure) {
                failure.addSuppressed(t);
                RunEventLogger.teardownFailureSuppressed(testId, t);
            }
        }

        if (failure != null) {
            throw failure;
        }
    }
}
