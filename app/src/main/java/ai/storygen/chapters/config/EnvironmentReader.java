package ai.storygen.chapters.config;

import java.util.Optional;

/**
 * Source of environment-style settings, keyed by variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
