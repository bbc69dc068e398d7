package ai.storygen.chapters.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        InputFormat inputFormat,
        List<Path> inputPaths,
        Path outputDirectory,
        LogFormat logFormat,
        LogLevel logLevel,
        boolean failFast
) {

    public Config {
        Objects.requireNonNull(inputFormat, "inputFormat");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        logLevel = logLevel == null ? LogLevel.INFO : logLevel;
        inputPaths = List.copyOf(Objects.requireNonNull(inputPaths, "inputPaths"));
        if (inputPaths.isEmpty()) {
            throw new IllegalArgumentException("at least one input path must be provided");
        }
    }
}
