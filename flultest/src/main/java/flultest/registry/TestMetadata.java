package flultest.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable identity of a registered test: suite name, test name and tags.
 *
 * <p>Tags are held as a lexicographically sorted set; {@code --list-verbose} prints
 * them in that order. The identity used for name filtering is {@code suite::test}.
 *
 * @see TestEntry
 */
public final class TestMetadata {

    private final String suiteName;
    private final String testName;
    private final SortedSet<String> tags;

    /**
     * Creates test metadata.
     *
     * @param suiteName the suite name
     * @param testName the test name
     * @param tags the tags; duplicates collapse, null elements are rejected
     */
    public TestMetadata(String suiteName, String testName, Collection<String> tags) {
        this.suiteName = Objects.requireNonNull(suiteName, "suiteName");
        this.testName = Objects.requireNonNull(testName, "testName");
        TreeSet<String> sorted = new TreeSet<>();
        for (String tag : tags) {
            sorted.add(Objects.requireNonNull(tag, "tag"));
        }
        this.tags = Collections.unmodifiableSortedSet(sorted);
    }

    public String suiteName() { return suiteName; }

    public String testName() { return testName; }

    /** Returns the unique tags in lexicographic order. */
    public SortedSet<String> tags() { return tags; }

    /**
     * Returns true if this test carries {@code tag}. Matching is exact and case-sensitive.
     *
     * @param tag the tag to look for
     * @return true if present
     */
    public boolean hasTag(String tag) {
        return tag != null && tags.contains(tag);
    }

    /** Returns {@code suite::test}. */
    public String identity() {
        return suiteName + "::" + testName;
    }

    @Override
    public String toString() {
        return tags.isEmpty() ? identity() : identity() + " " + tags;
    }
}
