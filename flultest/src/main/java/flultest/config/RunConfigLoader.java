package flultest.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads run configuration from properties or YAML files.
 *
 * <p>Classpath lookup order:
 * <ol>
 *   <li>{@code flultest.properties}</li>
 *   <li>{@code flultest.yml}</li>
 * </ol>
 *
 * <p>System properties with the same keys override file values
 * (e.g. {@code -Dflultest.tags.exclude=slow}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code flultest.filter} - substring a test identity must contain</li>
 *   <li>{@code flultest.tags.include} - comma-separated tags, a test needs one of them</li>
 *   <li>{@code flultest.tags.exclude} - comma-separated tags that exclude a test</li>
 *   <li>{@code flultest.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * <p>In YAML the tag keys may also hold lists.
 *
 * @see RunConfig
 */
public final class RunConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(RunConfigLoader.class);

    static final String PROPERTIES_RESOURCE = "flultest.properties";
    static final String YAML_RESOURCE = "flultest.yml";

    private RunConfigLoader() {}

    /**
     * Load from classpath ({@code flultest.properties} or {@code flultest.yml}).
     *
     * @throws RunConfigException if no config file is found
     */
    public static RunConfig load() {
        return loadFromClasspath().orElseThrow(() -> new RunConfigException(
                "Config file required: " + PROPERTIES_RESOURCE + " or " + YAML_RESOURCE));
    }

    /**
     * Load from classpath, falling back to defaults (plus system properties) when
     * neither file exists.
     *
     * @return the loaded or default configuration
     */
    public static RunConfig loadIfPresent() {
        return loadFromClasspath().orElseGet(() -> parse(new Properties()));
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws RunConfigException if the file cannot be parsed
     */
    public static RunConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    public static RunConfig loadFromFile(String path) throws IOException {
        return loadFromFile(Path.of(path));
    }

    private static Optional<RunConfig> loadFromClasspath() {
        try (InputStream is = getResource(PROPERTIES_RESOURCE)) {
            if (is != null) {
                return Optional.of(loadProperties(is, PROPERTIES_RESOURCE));
            }
        } catch (IOException e) {
            throw new RunConfigException("Failed to close " + PROPERTIES_RESOURCE, e);
        }
        try (InputStream is = getResource(YAML_RESOURCE)) {
            if (is != null) {
                return Optional.of(loadYaml(is, YAML_RESOURCE));
            }
        } catch (IOException e) {
            throw new RunConfigException("Failed to close " + YAML_RESOURCE, e);
        }
        return Optional.empty();
    }

    private static InputStream getResource(String name) {
        return RunConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static RunConfig loadProperties(InputStream is, String source) {
        try {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException | IllegalArgumentException e) {
            throw new RunConfigException("Failed to load " + source, e);
        }
    }

    private static RunConfig loadYaml(InputStream is, String source) {
        Object root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new RunConfigException("Failed to parse " + source, e);
        }
        Properties props = new Properties();
        if (root instanceof Map) {
            flatten("", asMap(root), props);
        } else if (root != null) {
            throw new RunConfigException(source + " must contain a mapping, found " + root.getClass().getSimpleName());
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, asMap(val), props);
            } else if (val instanceof List) {
                List<String> items = new ArrayList<>();
                for (Object item : (List<?>) val) {
                    items.add(String.valueOf(item));
                }
                props.setProperty(key, String.join(",", items));
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static RunConfig parse(Properties props) {
        RunConfig.Builder b = RunConfig.builder();

        getString(props, "flultest.filter")
                .filter(v -> !v.isEmpty())
                .ifPresent(b::nameFilter);
        getString(props, "flultest.tags.include").map(RunConfigLoader::splitTags).ifPresent(b::includeTags);
        getString(props, "flultest.tags.exclude").map(RunConfigLoader::splitTags).ifPresent(b::excludeTags);

        getString(props, "flultest.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static List<String> splitTags(String value) {
        List<String> tags = new ArrayList<>();
        for (String part : value.split(",")) {
            String tag = part.trim();
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }
}
