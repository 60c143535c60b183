package work.isu.core.api;

import java.util.Locale;

/**
 * Diagnostic thresholds, lowest first.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    /** Whether a message at {@code level} passes this threshold. */
    public boolean admits(LogLevel level) {
        return level.ordinal() >= ordinal();
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}
