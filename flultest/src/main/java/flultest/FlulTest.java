package flultest;

import flultest.alert.RunEventLogger;
import flultest.cli.CommandLineException;
import flultest.cli.CommandLineOptions;
import flultest.config.RunConfig;
import flultest.config.RunConfigException;
import flultest.config.RunConfigLoader;
import flultest.registry.Registry;
import flultest.runner.Runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Entry point for test binaries.
 *
 * <p>Typical {@code main}:
 * <pre>{@code
 * public static void main(String[] args) {
 *     Registry registry = new Registry();
 *     MathSuite.register(registry);
 *     FlulTest.exit(args, registry);
 * }
 * }</pre>
 *
 * <p>Selection is applied in a fixed order: configuration is loaded, the command-line
 * flags are merged on top, then name filters, include tags and exclude tags narrow the
 * registry. {@code --list} is checked before {@code --list-verbose}; with neither, the
 * remaining tests run.
 *
 * @see CommandLineOptions
 * @see RunConfigLoader
 */
public final class FlulTest {

    private static final Logger log = LoggerFactory.getLogger(FlulTest.class);

    private FlulTest() {}

    /**
     * Runs the dispatcher against {@code System.out} and {@code System.err}, both UTF-8 encoded.
     *
     * @return the process exit code
     */
    public static int run(String[] args, Registry registry) {
        return run(args, registry, Runner.utf8(System.out), Runner.utf8(System.err));
    }

    /**
     * Parses {@code args}, narrows {@code registry} and lists or runs the remaining tests.
     *
     * @param args command-line arguments
     * @param registry the populated registry; filtered in place
     * @param out destination for listings, results and help
     * @param err destination for usage errors
     * @return 0 on success, 1 on a usage error or any failed test
     */
    public static int run(String[] args, Registry registry, PrintStream out, PrintStream err) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (CommandLineException e) {
            err.println("error: " + e.getMessage());
            if (e.showUsage()) {
                err.println(CommandLineOptions.usage());
            }
            err.flush();
            return 1;
        }

        if (options.help()) {
            out.println(CommandLineOptions.usage());
            out.flush();
            return 0;
        }

        RunConfig config;
        try {
            config = options.applyTo(loadConfig(options));
        } catch (IOException e) {
            log.debug("Configuration file unreadable", e);
            err.println("error: cannot read config file " + options.configPath().orElse(""));
            err.flush();
            return 1;
        } catch (RunConfigException e) {
            log.debug("Configuration failed", e);
            err.println("error: " + e.getMessage());
            err.flush();
            return 1;
        }
        log.debug("Effective configuration: {}", config);
        RunEventLogger.setAlertLevel(config.alertLevel());

        config.nameFilters().forEach(registry::filter);
        registry.filterByTag(config.includeTags());
        registry.excludeByTag(config.excludeTags());

        if (options.list()) {
            registry.list(out);
            return 0;
        }
        if (options.listVerbose()) {
            registry.listVerbose(out);
            return 0;
        }
        return new Runner(registry, out).runAll();
    }

    /**
     * Runs the dispatcher and terminates the JVM with its exit code.
     */
    public static void exit(String[] args, Registry registry) {
        System.exit(run(args, registry));
    }

    private static RunConfig loadConfig(CommandLineOptions options) throws IOException {
        if (options.configPath().isPresent()) {
            return RunConfigLoader.loadFromFile(options.configPath().get());
        }
        return RunConfigLoader.loadIfPresent();
    }
}
