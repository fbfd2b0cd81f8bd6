package flultest.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("flultest.filter");
        System.clearProperty("flultest.tags.exclude");
    }

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                flultest.filter=MathSuite
                flultest.tags.include=fast, unit
                flultest.tags.exclude=slow
                flultest.alert.level=debug
                """);

        RunConfig c = RunConfigLoader.loadFromFile(f);

        assertEquals(List.of("MathSuite"), c.nameFilters());
        assertEquals(List.of("fast", "unit"), c.includeTags());
        assertEquals(List.of("slow"), c.excludeTags());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path f = tempDir.resolve("test.yml");
        Files.writeString(f, """
                flultest:
                  filter: Parsing
                  tags:
                    include: [fast, edge]
                    exclude: broken,flaky
                  alert:
                    level: ERROR
                """);

        RunConfig c = RunConfigLoader.loadFromFile(f);

        assertEquals(List.of("Parsing"), c.nameFilters());
        assertEquals(List.of("fast", "edge"), c.includeTags());
        assertEquals(List.of("broken", "flaky"), c.excludeTags());
        assertEquals(AlertLevel.ERROR, c.alertLevel());
    }

    @Test
    void emptyYamlGivesDefaults() throws IOException {
        Path f = tempDir.resolve("empty.yaml");
        Files.writeString(f, "");

        RunConfig c = RunConfigLoader.loadFromFile(f);

        assertTrue(c.nameFilters().isEmpty());
        assertTrue(c.includeTags().isEmpty());
        assertTrue(c.excludeTags().isEmpty());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
    }

    @Test
    void invalidAlertLevelKeepsDefault() throws IOException {
        Path f = tempDir.resolve("bad.properties");
        Files.writeString(f, "flultest.alert.level=LOUD\n");

        assertEquals(AlertLevel.WARNING, RunConfigLoader.loadFromFile(f).alertLevel());
    }

    @Test
    void blankValuesAreIgnored() throws IOException {
        Path f = tempDir.resolve("blank.properties");
        Files.writeString(f, "flultest.filter=\nflultest.tags.include= , ,\n");

        RunConfig c = RunConfigLoader.loadFromFile(f);

        assertTrue(c.nameFilters().isEmpty());
        assertTrue(c.includeTags().isEmpty());
    }

    @Test
    void malformedYamlThrows() throws IOException {
        Path f = tempDir.resolve("broken.yml");
        Files.writeString(f, "flultest: [unclosed\n");

        assertThrows(RunConfigException.class, () -> RunConfigLoader.loadFromFile(f));
    }

    @Test
    void scalarYamlThrows() throws IOException {
        Path f = tempDir.resolve("scalar.yml");
        Files.writeString(f, "just text\n");

        RunConfigException e = assertThrows(RunConfigException.class, () -> RunConfigLoader.loadFromFile(f));
        assertTrue(e.getMessage().contains("mapping"));
    }

    @Test
    void missingFileThrowsIOException() {
        assertThrows(IOException.class, () -> RunConfigLoader.loadFromFile(tempDir.resolve("absent.yml")));
    }

    @Test
    void systemPropertiesOverrideFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, "flultest.filter=FromFile\nflultest.tags.exclude=slow\n");
        System.setProperty("flultest.filter", "FromSystem");
        System.setProperty("flultest.tags.exclude", "slow,flaky");

        RunConfig c = RunConfigLoader.loadFromFile(f);

        assertEquals(List.of("FromSystem"), c.nameFilters());
        assertEquals(List.of("slow", "flaky"), c.excludeTags());
    }

    @Test
    void loadWithoutClasspathFileThrows() {
        assertThrows(RunConfigException.class, RunConfigLoader::load);
    }

    @Test
    void loadIfPresentFallsBackToDefaults() {
        RunConfig c = RunConfigLoader.loadIfPresent();

        assertTrue(c.nameFilters().isEmpty());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
    }
}
