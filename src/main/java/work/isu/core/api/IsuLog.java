package work.isu.core.api;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Threshold-gated diagnostics on standard error.
 */
public final class IsuLog {
    private final LogLevel threshold;
    private final PrintStream err;

    public IsuLog(LogLevel threshold) {
        this(threshold, System.err);
    }

    public IsuLog(LogLevel threshold, PrintStream err) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static IsuLog silent() {
        return new IsuLog(LogLevel.FATAL);
    }

    public LogLevel threshold() {
        return threshold;
    }

    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    public void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    public void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    public void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }

    public void log(LogLevel level, String format, Object... args) {
        if (!threshold.admits(level)) {
            return;
        }
        err.printf("[isu] %s %s%n", level.name().toLowerCase(Locale.ROOT), String.format(format, args));
    }
}
