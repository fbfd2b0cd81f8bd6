package flultest;

import flultest.registry.Registry;
import flultest.suite.Suite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static flultest.expect.Expect.expect;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FlulTest")
class FlulTestTest {

    static class SampleSuite extends Suite {
        void passes() {
            expect("ok").toEqual("ok");
        }

        void fails() {
            expect(2).toBeLessThan(1);
        }
    }

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private Registry registry;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        registry = new Registry(new PrintStream(errBytes, true, StandardCharsets.UTF_8));
        registry.add("Alpha", "fastPass", SampleSuite::new, SampleSuite::passes, "fast");
        registry.add("Alpha", "slowPass", SampleSuite::new, SampleSuite::passes, "slow");
        registry.add("Beta", "fastFail", SampleSuite::new, SampleSuite::fails, "fast", "broken");
        registry.add("Beta", "untagged", SampleSuite::new, SampleSuite::passes);
    }

    private int run(String... args) {
        return FlulTest.run(args, registry,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("listing")
    class Listing {

        @Test
        @DisplayName("should list bare identities and exit 0 without running")
        void shouldList() {
            assertThat(run("--list")).isZero();

            assertThat(out().lines()).containsExactly(
                    "Alpha::fastPass", "Alpha::slowPass", "Beta::fastFail", "Beta::untagged");
            assertThat(out()).doesNotContain("PASS");
        }

        @Test
        @DisplayName("should apply filters before listing")
        void shouldFilterBeforeListing() {
            assertThat(run("--list", "--tag", "fast", "--exclude-tag", "broken")).isZero();

            assertThat(out().lines()).containsExactly("Alpha::fastPass");
        }

        @Test
        @DisplayName("should prefer --list over --list-verbose")
        void shouldPreferList() {
            assertThat(run("--list-verbose", "--list", "--filter", "Beta")).isZero();

            assertThat(out().lines()).containsExactly("Beta::fastFail", "Beta::untagged");
        }

        @Test
        @DisplayName("should list tags in verbose mode")
        void shouldListVerbose() {
            assertThat(run("--list-verbose", "--filter", "Beta")).isZero();

            assertThat(out().lines()).containsExactly("Beta::fastFail [broken, fast]", "Beta::untagged");
        }
    }

    @Nested
    @DisplayName("running")
    class Running {

        @Test
        @DisplayName("should exit 1 when any selected test fails")
        void shouldExitOneOnFailure() {
            assertThat(run()).isEqualTo(1);

            assertThat(out()).contains("[ FAIL ] Beta::fastFail").contains("4 tests, 3 passed, 1 failed");
        }

        @Test
        @DisplayName("should exit 0 when the failing test is excluded")
        void shouldExitZeroWhenExcluded() {
            assertThat(run("--exclude-tag", "broken")).isZero();

            assertThat(out()).contains("3 tests, 3 passed, 0 failed");
        }

        @Test
        @DisplayName("should require every name filter to match")
        void shouldAndNameFilters() {
            assertThat(run("--filter", "Alpha", "--filter", "slow")).isZero();

            assertThat(out()).contains("[ PASS ] Alpha::slowPass").contains("1 tests, 1 passed, 0 failed");
        }

        @Test
        @DisplayName("should exit 0 with an empty summary when nothing is selected")
        void shouldRunNothing() {
            assertThat(run("--tag", "nonexistent")).isZero();

            assertThat(out()).contains("0 tests, 0 passed, 0 failed");
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("should combine an explicit config file with flags")
        void shouldUseConfigFile() throws IOException {
            Path config = tempDir.resolve("flultest.yml");
            Files.writeString(config, """
                    flultest:
                      tags:
                        exclude: broken
                    """);

            assertThat(run("--config", config.toString(), "--list", "--tag", "fast")).isZero();

            assertThat(out().lines()).containsExactly("Alpha::fastPass");
        }

        @Test
        @DisplayName("should exit 1 when the config file cannot be read")
        void shouldFailOnMissingConfig() {
            Path missing = tempDir.resolve("missing.properties");

            assertThat(run("--config", missing.toString())).isEqualTo(1);

            assertThat(err()).startsWith("error: cannot read config file " + missing);
            assertThat(out()).isEmpty();
        }
    }

    @Nested
    @DisplayName("usage errors")
    class UsageErrors {

        @Test
        @DisplayName("should print usage and exit 0 on --help")
        void shouldPrintHelp() {
            assertThat(run("--help")).isZero();

            assertThat(out()).startsWith("usage: flul-test [options]");
            assertThat(err()).isEmpty();
        }

        @Test
        @DisplayName("should print error and usage and exit 1 on an unknown flag")
        void shouldRejectUnknownFlag() {
            assertThat(run("--bogus")).isEqualTo(1);

            assertThat(err().lines().findFirst()).hasValue("error: unknown option '--bogus'");
            assertThat(err()).contains("usage: flul-test [options]");
            assertThat(out()).isEmpty();
        }

        @Test
        @DisplayName("should exit 1 when a flag misses its value")
        void shouldRejectMissingValue() {
            assertThat(run("--filter")).isEqualTo(1);

            assertThat(err().lines()).containsExactly("error: --filter requires an argument");
        }

        @Test
        @DisplayName("should not run tests on a usage error")
        void shouldNotRunOnUsageError() {
            run("--tag");

            assertThat(out()).doesNotContain("tests,");
        }
    }
}
