package flultest.config;

/**
 * Thrown when run configuration cannot be loaded or parsed.
 *
 * <p>Unchecked, so configuration loading can sit in a {@code main} method without
 * forced handling.
 *
 * @see RunConfigLoader
 */
public class RunConfigException extends RuntimeException {

    public RunConfigException(String message) {
        super(message);
    }

    public RunConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
