package flultest.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Default selection and logging settings for a test run.
 *
 * <p>Values come from {@code flultest.properties} / {@code flultest.yml} via
 * {@link RunConfigLoader}; command-line flags are merged on top with
 * {@link Builder#from(RunConfig)}.
 *
 * <p>Selection is applied in this order: every name filter, then the include tags,
 * then the exclude tags.
 *
 * @see RunConfigLoader
 */
public final class RunConfig {

    public static final RunConfig DEFAULTS = builder().build();

    private final List<String> nameFilters;
    private final List<String> includeTags;
    private final List<String> excludeTags;
    private final AlertLevel alertLevel;

    private RunConfig(Builder b) {
        this.nameFilters = List.copyOf(b.nameFilters);
        this.includeTags = List.copyOf(b.includeTags);
        this.excludeTags = List.copyOf(b.excludeTags);
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the name substrings a test identity must contain, applied in order. */
    public List<String> nameFilters() { return nameFilters; }

    /** Returns the tags of which a test must carry at least one; empty means no restriction. */
    public List<String> includeTags() { return includeTags; }

    /** Returns the tags that exclude a test. */
    public List<String> excludeTags() { return excludeTags; }

    /** Returns the alert level for the event log. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "RunConfig{" +
                "nameFilters=" + nameFilters +
                ", includeTags=" + includeTags +
                ", excludeTags=" + excludeTags +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for {@link RunConfig}.
     */
    public static final class Builder {
        private final List<String> nameFilters = new ArrayList<>();
        private final List<String> includeTags = new ArrayList<>();
        private final List<String> excludeTags = new ArrayList<>();
        private AlertLevel alertLevel = AlertLevel.WARNING;

        /** Starts from the values of an existing configuration. */
        public Builder from(RunConfig config) {
            nameFilters.addAll(config.nameFilters);
            includeTags.addAll(config.includeTags);
            excludeTags.addAll(config.excludeTags);
            alertLevel = config.alertLevel;
            return this;
        }

        public Builder nameFilter(String pattern) {
            nameFilters.add(Objects.requireNonNull(pattern, "pattern"));
            return this;
        }

        public Builder includeTag(String tag) {
            includeTags.add(Objects.requireNonNull(tag, "tag"));
            return this;
        }

        public Builder includeTags(Collection<String> tags) {
            tags.forEach(this::includeTag);
            return this;
        }

        public Builder excludeTag(String tag) {
            excludeTags.add(Objects.requireNonNull(tag, "tag"));
            return this;
        }

        public Builder excludeTags(Collection<String> tags) {
            tags.forEach(this::excludeTag);
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = Objects.requireNonNull(level, "level");
            return this;
        }

        public RunConfig build() {
            return new RunConfig(this);
        }
    }
}
