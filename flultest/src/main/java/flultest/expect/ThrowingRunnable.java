package flultest.expect;

/**
 * Zero-argument code block that may throw anything; the subject of {@link ExpectCallable}.
 */
@FunctionalInterface
public interface ThrowingRunnable {

    void run() throws Throwable;
}
