package ai.storygen.chapters.config;

import ai.storygen.chapters.cli.CliArguments;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUT_PATHS = "STORYGEN_INPUT_PATHS";
    static final String ENV_OUTPUT_DIR = "STORYGEN_OUTPUT_DIR";
    static final String ENV_INPUT_FORMAT = "STORYGEN_INPUT_FORMAT";
    static final String ENV_FAIL_FAST = "STORYGEN_FAIL_FAST";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "LOG_LEVEL";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        InputFormat inputFormat = resolveInputFormat(arguments);
        List<Path> inputPaths = resolveInputPaths(arguments);
        Path outputDirectory = resolveOutputDirectory(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        LogLevel logLevel = resolveLogLevel(arguments);
        boolean failFast = resolveFailFast(arguments);
        return new Config(inputFormat, inputPaths, outputDirectory, logFormat, logLevel, failFast);
    }

    private InputFormat resolveInputFormat(CliArguments arguments) {
        InputFormat cliFormat = arguments.inputFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_INPUT_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(InputFormat::from)
                .orElse(InputFormat.HTML);
    }

    private List<Path> resolveInputPaths(CliArguments arguments) {
        List<Path> cliPaths = arguments.inputPaths();
        if (cliPaths != null && !cliPaths.isEmpty()) {
            return cliPaths;
        }
        return environmentReader.get(ENV_INPUT_PATHS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parsePaths)
                .filter(paths -> !paths.isEmpty())
                .orElseThrow(() -> new IllegalArgumentException("at least one input path must be provided"));
    }

    private Path resolveOutputDirectory(CliArguments arguments) {
        if (arguments.outputDirectory() != null) {
            return arguments.outputDirectory();
        }
        return environmentReader.get(ENV_OUTPUT_DIR)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Path::of)
                .orElseThrow(() -> new IllegalArgumentException("output directory must be provided"));
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private LogLevel resolveLogLevel(CliArguments arguments) {
        if (arguments.debug()) {
            return LogLevel.DEBUG;
        }
        return environmentReader.get(ENV_LOG_LEVEL)
                .filter(ConfigLoader::isNotBlank)
                .map(LogLevel::from)
                .orElse(LogLevel.INFO);
    }

    private boolean resolveFailFast(CliArguments arguments) {
        if (arguments.failFast()) {
            return true;
        }
        return environmentReader.get(ENV_FAIL_FAST)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<Path> parsePaths(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(Path::of)
                .collect(Collectors.toList());
    }
}
