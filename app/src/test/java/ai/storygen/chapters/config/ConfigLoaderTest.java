package ai.storygen.chapters.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.storygen.chapters.cli.CliArguments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--outdir", "out",
                "--format", "epub",
                "--log-format", "json",
                "--fail-fast",
                "-d",
                "books/a.epub", "books/more");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.inputFormat()).isEqualTo(InputFormat.EPUB);
        assertThat(config.inputPaths()).containsExactly(Path.of("books/a.epub"), Path.of("books/more"));
        assertThat(config.outputDirectory()).isEqualTo(Path.of("out"));
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.logLevel()).isEqualTo(LogLevel.DEBUG);
        assertThat(config.failFast()).isTrue();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_INPUT_PATHS, "first, second ,");
        envValues.put(ConfigLoader.ENV_OUTPUT_DIR, " target/books ");
        envValues.put(ConfigLoader.ENV_INPUT_FORMAT, "Text");
        envValues.put(ConfigLoader.ENV_LOG_LEVEL, "warning");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_FAIL_FAST, "1");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.inputFormat()).isEqualTo(InputFormat.TEXT);
        assertThat(config.inputPaths()).containsExactly(Path.of("first"), Path.of("second"));
        assertThat(config.outputDirectory()).isEqualTo(Path.of("target/books"));
        assertThat(config.logLevel()).isEqualTo(LogLevel.WARN);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.failFast()).isTrue();
    }

    @Test
    void cliValuesTakePrecedenceOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_INPUT_PATHS, "from-env",
                ConfigLoader.ENV_OUTPUT_DIR, "env-out"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-o", "cli-out", "from-cli");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.inputPaths()).containsExactly(Path.of("from-cli"));
        assertThat(config.outputDirectory()).isEqualTo(Path.of("cli-out"));
        assertThat(config.inputFormat()).isEqualTo(InputFormat.HTML);
        assertThat(config.failFast()).isFalse();
        assertThat(environmentReader.requestedKeys()).doesNotContain(ConfigLoader.ENV_INPUT_PATHS, ConfigLoader.ENV_OUTPUT_DIR);
    }

    @Test
    void missingInputPathsThrows() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--outdir", "out");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("input path");
    }

    @Test
    void missingOutputDirectoryThrows() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "books");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("output directory");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
