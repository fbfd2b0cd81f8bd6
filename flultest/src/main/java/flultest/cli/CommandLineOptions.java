package flultest.cli;

import flultest.config.RunConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed command-line flags of a test binary.
 *
 * <p>Values following {@code --filter}, {@code --tag}, {@code --exclude-tag} and
 * {@code --config} are taken verbatim, even when they start with {@code --}.
 * {@code --help} stops parsing as soon as it is seen.
 */
public final class CommandLineOptions {

    static final String USAGE = String.join(System.lineSeparator(),
            "usage: flul-test [options]",
            "  --list                 print test identities and exit",
            "  --list-verbose         print test identities with tags and exit",
            "  --filter <pattern>     run tests whose suite::test contains <pattern> (repeatable)",
            "  --tag <tag>            run tests carrying <tag> (repeatable)",
            "  --exclude-tag <tag>    skip tests carrying <tag> (repeatable)",
            "  --config <path>        load settings from a .properties or .yml file",
            "  --help                 print this help and exit");

    private final boolean list;
    private final boolean listVerbose;
    private final boolean help;
    private final List<String> filters;
    private final List<String> includeTags;
    private final List<String> excludeTags;
    private final String configPath;

    private CommandLineOptions(boolean list, boolean listVerbose, boolean help,
                               List<String> filters, List<String> includeTags,
                               List<String> excludeTags, String configPath) {
        this.list = list;
        this.listVerbose = listVerbose;
        this.help = help;
        this.filters = List.copyOf(filters);
        this.includeTags = List.copyOf(includeTags);
        this.excludeTags = List.copyOf(excludeTags);
        this.configPath = configPath;
    }

    /**
     * Parses command-line arguments.
     *
     * @param args the arguments passed to {@code main}
     * @return the parsed options
     * @throws CommandLineException on an unknown flag or a flag missing its value
     */
    public static CommandLineOptions parse(String... args) throws CommandLineException {
        boolean list = false;
        boolean listVerbose = false;
        List<String> filters = new ArrayList<>();
        List<String> includeTags = new ArrayList<>();
        List<String> excludeTags = new ArrayList<>();
        String configPath = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help":
                    return new CommandLineOptions(false, false, true, List.of(), List.of(), List.of(), null);
                case "--list":
                    list = true;
                    break;
                case "--list-verbose":
                    listVerbose = true;
                    break;
                case "--filter":
                    filters.add(value(args, ++i, arg));
                    break;
                case "--tag":
                    includeTags.add(value(args, ++i, arg));
                    break;
                case "--exclude-tag":
                    excludeTags.add(value(args, ++i, arg));
                    break;
                case "--config":
                    configPath = value(args, ++i, arg);
                    break;
                default:
                    throw new CommandLineException("unknown option '" + arg + "'", true);
            }
        }
        return new CommandLineOptions(list, listVerbose, false, filters, includeTags, excludeTags, configPath);
    }

    private static String value(String[] args, int index, String flag) throws CommandLineException {
        if (index >= args.length) {
            throw new CommandLineException(flag + " requires an argument", false);
        }
        return args[index];
    }

    /**
     * Merges these flags on top of a loaded configuration. Name filters and tags are
     * appended after the configured ones.
     */
    public RunConfig applyTo(RunConfig config) {
        RunConfig.Builder b = RunConfig.builder().from(config);
        filters.forEach(b::nameFilter);
        b.includeTags(includeTags);
        b.excludeTags(excludeTags);
        return b.build();
    }

    public boolean list() { return list; }

    public boolean listVerbose() { return listVerbose; }

    public boolean help() { return help; }

    public List<String> filters() { return filters; }

    public List<String> includeTags() { return includeTags; }

    public List<String> excludeTags() { return excludeTags; }

    public Optional<String> configPath() { return Optional.ofNullable(configPath); }

    /** Returns the usage text, without a trailing line separator. */
    public static String usage() { return USAGE; }
}
