package flultest.config;

/**
 * Minimum severity of run events written by {@link flultest.alert.RunEventLogger}.
 *
 * <p>Configured with {@code flultest.alert.level}. Console output of the runner is not
 * affected; this only governs the slf4j event log.
 */
public enum AlertLevel {

    /** Every event: run started, each passed and failed test, run completed. */
    DEBUG,

    /** Failed tests and suppressed teardown failures. The default. */
    WARNING,

    /** Suppressed teardown failures only. */
    ERROR
}
