package flultest.registry;

import java.util.Objects;

/**
 * A registered, runnable test: its metadata plus the invocation that runs it.
 *
 * <p>Entries are immutable. Filters remove entries from the {@link Registry}; they
 * never change them.
 */
public final class TestEntry {

    private final TestMetadata metadata;
    private final TestInvocation invocation;

    public TestEntry(TestMetadata metadata, TestInvocation invocation) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.invocation = Objects.requireNonNull(invocation, "invocation");
    }

    public TestMetadata metadata() { return metadata; }

    /** Shorthand for {@code metadata().hasTag(tag)}. */
    public boolean hasTag(String tag) {
        return metadata.hasTag(tag);
    }

    /** Shorthand for {@code metadata().identity()}. */
    public String identity() {
        return metadata.identity();
    }

    /**
     * Runs the test once, on a fresh fixture.
     *
     * @throws Throwable whatever the test or its fixture raised
     */
    public void invoke() throws Throwable {
        invocation.invoke();
    }

    @Override
    public String toString() {
        return metadata.toString();
    }
}
