package flultest.cli;

/**
 * Exception thrown when command-line arguments are malformed.
 *
 * <p>The message is printed to the diagnostic stream prefixed with {@code error: },
 * and the process exits with status 1 before any test executes.
 *
 * @see CommandLineOptions#parse(String...)
 */
public class CommandLineException extends Exception {

    private final boolean showUsage;

    /**
     * Creates a new command-line exception.
     *
     * @param message a description of the problem
     * @param showUsage whether the usage text should follow the message
     */
    public CommandLineException(String message, boolean showUsage) {
        super(message);
        this.showUsage = showUsage;
    }

    /** Returns true when the usage text should be printed after the message. */
    public boolean showUsage() { return showUsage; }
}
