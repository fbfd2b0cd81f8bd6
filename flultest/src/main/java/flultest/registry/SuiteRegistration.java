package flultest.registry;

import flultest.suite.Suite;
import flultest.suite.SuiteMethod;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builder registering several tests of one suite at once, with optional group tags.
 *
 * <p>Group tags are applied to every test, ahead of the test's own tags, before
 * duplicate detection. A duplicate inside the group list is therefore reported once
 * per test.
 *
 * <h2>Usage:</h2>
 * <pre>
 * registry.suite("StackSuite", StackSuite::new)
 *         .tags("unit")
 *         .test("pushThenPop", StackSuite::pushThenPop)
 *         .test("popEmptyThrows", StackSuite::popEmptyThrows, "edge")
 *         .register();
 * </pre>
 *
 * @param <S> the suite type
 * @see Registry#suite(String, Supplier)
 */
public final class SuiteRegistration<S extends Suite> {

    private final Registry registry;
    private final String suiteName;
    private final Supplier<S> factory;
    private final List<String> groupTags = new ArrayList<>();
    private final List<PendingTest<S>> tests = new ArrayList<>();

    SuiteRegistration(Registry registry, String suiteName, Supplier<S> factory) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.suiteName = Objects.requireNonNull(suiteName, "suiteName");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Adds tags shared by every test of this registration.
     *
     * @param tags the group tags
     * @return this builder for method chaining
     */
    public SuiteRegistration<S> tags(String... tags) {
        groupTags.addAll(Arrays.asList(tags));
        return this;
    }

    /**
     * Adds a test.
     *
     * @param testName the test name
     * @param method the test body
     * @param tags tags of this test only
     * @return this builder for method chaining
     */
    public SuiteRegistration<S> test(String testName, SuiteMethod<S> method, String... tags) {
        tests.add(new PendingTest<>(testName, method, Arrays.asList(tags)));
        return this;
    }

    /**
     * Registers all collected tests, in the order they were added.
     *
     * @return the new entries
     */
    public List<TestEntry> register() {
        List<TestEntry> added = new ArrayList<>(tests.size());
        for (PendingTest<S> t : tests) {
            List<String> tags = new ArrayList<>(groupTags);
            tags.addAll(t.tags);
            added.add(registry.add(suiteName, t.name, factory, t.method, tags));
        }
        return added;
    }

    private static final class PendingTest<S extends Suite> {
        private final String name;
        private final SuiteMethod<S> method;
        private final List<String> tags;

        private PendingTest(String name, SuiteMethod<S> method, List<String> tags) {
            this.name = name;
            this.method = method;
            this.tags = tags;
        }
    }
}
