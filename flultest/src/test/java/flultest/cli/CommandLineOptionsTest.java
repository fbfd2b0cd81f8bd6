package flultest.cli;

import flultest.config.AlertLevel;
import flultest.config.RunConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CommandLineOptions")
class CommandLineOptionsTest {

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("should default to running everything")
        void shouldDefaultToRun() throws CommandLineException {
            CommandLineOptions options = CommandLineOptions.parse();

            assertThat(options.list()).isFalse();
            assertThat(options.listVerbose()).isFalse();
            assertThat(options.help()).isFalse();
            assertThat(options.filters()).isEmpty();
            assertThat(options.configPath()).isEmpty();
        }

        @Test
        @DisplayName("should collect repeatable flags in order")
        void shouldCollectRepeatables() throws CommandLineException {
            CommandLineOptions options = CommandLineOptions.parse(
                    "--tag", "fast", "--exclude-tag", "slow", "--tag", "unit",
                    "--filter", "Math", "--filter", "adds", "--list", "--config", "run.yml");

            assertThat(options.includeTags()).containsExactly("fast", "unit");
            assertThat(options.excludeTags()).containsExactly("slow");
            assertThat(options.filters()).containsExactly("Math", "adds");
            assertThat(options.list()).isTrue();
            assertThat(options.configPath()).hasValue("run.yml");
        }

        @Test
        @DisplayName("should take flag values verbatim")
        void shouldTakeValuesVerbatim() throws CommandLineException {
            CommandLineOptions options = CommandLineOptions.parse("--tag", "--list");

            assertThat(options.includeTags()).containsExactly("--list");
            assertThat(options.list()).isFalse();
        }

        @Test
        @DisplayName("should stop at --help")
        void shouldShortCircuitHelp() throws CommandLineException {
            CommandLineOptions options = CommandLineOptions.parse("--list", "--help", "--bogus");

            assertThat(options.help()).isTrue();
            assertThat(options.list()).isFalse();
        }

        @Test
        @DisplayName("should reject unknown options with usage")
        void shouldRejectUnknown() {
            assertThatThrownBy(() -> CommandLineOptions.parse("--verbose"))
                    .isInstanceOf(CommandLineException.class)
                    .hasMessage("unknown option '--verbose'")
                    .matches(e -> ((CommandLineException) e).showUsage());
        }

        @Test
        @DisplayName("should reject a missing value without usage")
        void shouldRejectMissingValue() {
            assertThatThrownBy(() -> CommandLineOptions.parse("--list", "--exclude-tag"))
                    .isInstanceOf(CommandLineException.class)
                    .hasMessage("--exclude-tag requires an argument")
                    .matches(e -> !((CommandLineException) e).showUsage());
        }
    }

    @Test
    @DisplayName("should append flags after the configured values")
    void shouldMergeIntoConfig() throws CommandLineException {
        RunConfig config = RunConfig.builder()
                .nameFilter("Suite")
                .excludeTag("broken")
                .alertLevel(AlertLevel.DEBUG)
                .build();

        RunConfig merged = CommandLineOptions.parse("--filter", "Math", "--exclude-tag", "slow").applyTo(config);

        assertThat(merged.nameFilters()).containsExactly("Suite", "Math");
        assertThat(merged.excludeTags()).containsExactly("broken", "slow");
        assertThat(merged.includeTags()).isEmpty();
        assertThat(merged.alertLevel()).isEqualTo(AlertLevel.DEBUG);
    }
}
