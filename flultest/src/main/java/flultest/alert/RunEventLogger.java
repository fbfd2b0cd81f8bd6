package flultest.alert;

import flultest.config.AlertLevel;
import flultest.expect.Stringify;
import flultest.runner.RunReport;
import flultest.runner.TestResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging of run events.
 *
 * <p>Each entry is an event name followed by key=value pairs, so log aggregators can
 * parse them:
 * <pre>
 * 12:00:00.000 INFO  flultest - RUN_STARTED tests=3
 * 12:00:00.001 INFO  flultest - TEST_PASSED id=MathSuite::adds duration_ns=1520
 * 12:00:00.002 WARN  flultest - TEST_FAILED id=MathSuite::divides outcome=FOREIGN_FAILURE error="threw: / by zero"
 * 12:00:00.003 INFO  flultest - RUN_COMPLETED total=3 passed=2 failed=1 duration_ms=3
 * </pre>
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs failed tests and suppressed teardown failures</li>
 *   <li>ERROR: logs suppressed teardown failures only</li>
 * </ul>
 */
public final class RunEventLogger {

    private static final Logger log = LoggerFactory.getLogger("flultest");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private RunEventLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level; null restores the default WARNING
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void runStarted(int testCount) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED tests={}", testCount);
        }
    }

    public static void testPassed(TestResult result) {
        if (shouldLogInfo()) {
            log.info("TEST_PASSED id={} duration_ns={}", result.metadata().identity(), result.durationNanos());
        }
    }

    public static void testFailed(TestResult result) {
        if (shouldLogWarn()) {
            String error = result.error().map(e -> firstLine(e.actual())).orElse("unknown");
            log.warn("TEST_FAILED id={} outcome={} error=\"{}\"",
                    result.metadata().identity(), result.outcome(), error);
        }
    }

    public static void runCompleted(RunReport report) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED total={} passed={} failed={} duration_ms={}",
                    report.total(), report.passed(), report.failed(), report.durationNanos() / 1_000_000L);
        }
    }

    /**
     * Log a teardown failure that was attached to an earlier failure of the same test.
     * Always logged.
     *
     * @param testId the {@code suite::test} identity
     * @param error the teardown failure
     */
    public static void teardownFailureSuppressed(String testId, Throwable error) {
        log.error("TEARDOWN_FAILURE_SUPPRESSED id={} error=\"{}\"", testId, Stringify.messageOf(error), error);
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }
}
