package flultest.registry;

import flultest.suite.FixtureInvocation;
import flultest.suite.Suite;
import flultest.suite.SuiteMethod;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Ordered collection of registered tests, with name and tag filters.
 *
 * <p>Tests are registered explicitly; there is no classpath scanning. Each entry
 * constructs a fresh suite instance whenever it is invoked.
 *
 * <p>Duplicate tags on one test are collapsed. Every repeated occurrence is reported
 * on the diagnostic stream, one line each:
 * <pre>
 * [flul-test] warning: duplicate tag "fast" on test MathSuite::adds -- ignoring
 * </pre>
 *
 * <p>Filters only remove entries; they compose in whatever order the caller applies
 * them. A registry must not be mutated while a {@link flultest.runner.Runner} is
 * executing it.
 *
 * <h2>Usage:</h2>
 * <pre>
 * Registry registry = new Registry();
 * registry.add("MathSuite", "adds", MathSuite::new, MathSuite::adds, "fast");
 * registry.filterByTag(List.of("fast"));
 * int exitCode = new Runner(registry).runAll();
 * </pre>
 *
 * <p>This class is not thread-safe.
 *
 * @see SuiteRegistration
 * @see flultest.runner.Runner
 */
public class Registry {

    private static final Logger log = LoggerFactory.getLogger(Registry.class);

    static final String DUPLICATE_TAG_WARNING =
            "[flul-test] warning: duplicate tag \"%s\" on test %s::%s -- ignoring";

    private final List<TestEntry> entries = new ArrayList<>();
    private final PrintStream diagnostics;

    /** Creates a registry reporting diagnostics on {@code System.err}. */
    public Registry() {
        this(System.err);
    }

    /**
     * Creates a registry reporting diagnostics on the given stream.
     *
     * @param diagnostics destination of duplicate-tag warnings
     */
    public Registry(PrintStream diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Registers one test.
     *
     * @param suiteName the suite name
     * @param testName the test name
     * @param factory creates a fresh suite instance per invocation, e.g. {@code MathSuite::new}
     * @param method the test body, e.g. {@code MathSuite::adds}
     * @param tags optional tags; repeated tags are reported and ignored
     * @param <S> the suite type
     * @return the new entry; it stays valid for the lifetime of the registry
     */
    public <S extends Suite> TestEntry add(String suiteName, String testName,
                                           Supplier<S> factory, SuiteMethod<S> method,
                                           String... tags) {
        return add(suiteName, testName, factory, method, Arrays.asList(tags));
    }

    /**
     * Registers one test with a tag collection.
     *
     * @see #add(String, String, Supplier, SuiteMethod, String...)
     */
    public <S extends Suite> TestEntry add(String suiteName, String testName,
                                           Supplier<S> factory, SuiteMethod<S> method,
                                           Collection<String> tags) {
        Objects.requireNonNull(suiteName, "suiteName");
        Objects.requireNonNull(testName, "testName");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(tags, "tags");

        TestMetadata metadata = new TestMetadata(suiteName, testName, deduplicate(suiteName, testName, tags));
        String id = metadata.identity();
        TestEntry entry = new TestEntry(metadata, () -> FixtureInvocation.invoke(id, factory, method));
        entries.add(entry);
        log.debug("Registered {} tags={}", id, metadata.tags());
        return entry;
    }

    /**
     * Starts a bulk registration for the tests of one suite.
     *
     * @param suiteName the suite name shared by all tests
     * @param factory creates a fresh suite instance per invocation
     * @param <S> the suite type
     * @return a builder; nothing is registered until {@link SuiteRegistration#register()}
     */
    public <S extends Suite> SuiteRegistration<S> suite(String suiteName, Supplier<S> factory) {
        return new SuiteRegistration<>(this, suiteName, factory);
    }

    private Set<String> deduplicate(String suiteName, String testName, Collection<String> tags) {
        Set<String> unique = new LinkedHashSet<>();
        for (String tag : tags) {
            Objects.requireNonNull(tag, "tag");
            if (!unique.add(tag)) {
                diagnostics.println(String.format(Locale.ROOT, DUPLICATE_TAG_WARNING, tag, suiteName, testName));
                diagnostics.flush();
            }
        }
        return unique;
    }

    /**
     * Returns the retained entries in registration order.
     *
     * @return an unmodifiable view; it reflects later filter calls
     */
    public List<TestEntry> tests() {
        return Collections.unmodifiableList(entries);
    }

    /** Returns the number of retained entries. */
    public int size() {
        return entries.size();
    }

    /**
     * Keeps only the entries whose {@code suite::test} identity contains {@code pattern}.
     * Matching is a plain, case-sensitive substring test.
     *
     * @param pattern the substring to look for
     */
    public void filter(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        removeIf(e -> !e.identity().contains(pattern), "filter \"" + pattern + "\"");
    }

    /**
     * Keeps only the entries that carry at least one of {@code includeTags}.
     * Does nothing when {@code includeTags} is empty.
     *
     * @param includeTags the accepted tags
     */
    public void filterByTag(Collection<String> includeTags) {
        Objects.requireNonNull(includeTags, "includeTags");
        if (includeTags.isEmpty()) {
            return;
        }
        removeIf(e -> includeTags.stream().noneMatch(e::hasTag), "include tags " + includeTags);
    }

    /**
     * Removes the entries that carry any of {@code excludeTags}.
     * Does nothing when {@code excludeTags} is empty.
     *
     * @param excludeTags the rejected tags
     */
    public void excludeByTag(Collection<String> excludeTags) {
        Objects.requireNonNull(excludeTags, "excludeTags");
        if (excludeTags.isEmpty()) {
            return;
        }
        removeIf(e -> excludeTags.stream().anyMatch(e::hasTag), "exclude tags " + excludeTags);
    }

    private void removeIf(Predicate<TestEntry> predicate, String description) {
        int before = entries.size();
        entries.removeIf(predicate);
        log.debug("Applied {}: {} -> {} tests", description, before, entries.size());
    }

    /** Prints the bare identities on {@code System.out}. */
    public void list() {
        list(System.out);
    }

    /**
     * Prints one bare {@code suite::test} identity per line. Never includes tags:
     * external discovery tooling parses this output.
     *
     * @param out the destination
     */
    public void list(PrintStream out) {
        for (TestEntry e : entries) {
            out.println(e.identity());
        }
        out.flush();
    }

    /** Prints identities with tags on {@code System.out}. */
    public void listVerbose() {
        listVerbose(System.out);
    }

    /**
     * Prints one identity per line followed by its sorted tags in brackets, e.g.
     * {@code S::A [alpha, beta]}. Untagged tests print the bare identity.
     *
     * @param out the destination
     */
    public void listVerbose(PrintStream out) {
        for (TestEntry e : entries) {
            Set<String> tags = e.metadata().tags();
            if (tags.isEmpty()) {
                out.println(e.identity());
            } else {
                out.println(e.identity() + " [" + String.join(", ", tags) + "]");
            }
        }
        out.flush();
    }
}
