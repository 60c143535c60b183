package work.isu.core.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for one {@link IsuRunner} execution.
 *
 * @param source Isu program file
 * @param inputPayload JSON object with the {@code INPUT} bindings
 * @param timeout wall-clock limit for interpretation
 * @param maxIterations total loop iterations allowed, {@code 0} for unlimited
 * @param cache memoise canonical programs by source text
 */
public record IsuRunConfiguration(
    Path source,
    String inputPayload,
    Optional<Duration> timeout,
    long maxIterations,
    LogLevel logLevel,
    boolean cache
) {
    public IsuRunConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(inputPayload, "inputPayload");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must not be negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path source;
        private String inputPayload = "{}";
        private Optional<Duration> timeout = Optional.empty();
        private long maxIterations;
        private LogLevel logLevel = LogLevel.WARN;
        private boolean cache;

        public Builder source(Path source) {
            this.source = source;
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxIterations(long maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder cache(boolean cache) {
            this.cache = cache;
            return this;
        }

        public IsuRunConfiguration build() {
            return new IsuRunConfiguration(source, inputPayload, timeout, maxIterations, logLevel, cache);
        }
    }
}
