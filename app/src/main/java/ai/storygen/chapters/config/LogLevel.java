package ai.storygen.chapters.config;

/**
 * Root log level of a run.
 */
public enum LogLevel {
    ERROR,
    WARN,
    INFO,
    DEBUG;

    public static LogLevel from(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        String value = raw.trim();
        if (value.equalsIgnoreCase("warning")) {
            return WARN;
        }
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported log level: " + raw);
    }
}
