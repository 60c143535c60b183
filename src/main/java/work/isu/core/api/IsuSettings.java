package work.isu.core.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.isu.core.shared.DurationParser;

/**
 * Project defaults read from {@code isu.toml}:
 *
 * <pre>
 * [run]
 * timeout = "30s"
 * max_iterations = 100000
 * log_level = "info"
 * cache = true
 * </pre>
 *
 * Command-line options take precedence over every value here.
 */
public record IsuSettings(Optional<Duration> timeout, Optional<Long> maxIterations, Optional<LogLevel> logLevel, Optional<Boolean> cache) {
    public static final String FILE_NAME = "isu.toml";

    public static IsuSettings empty() {
        return new IsuSettings(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    /** Loads {@code isu.toml} from {@code directory} if present. */
    public static IsuSettings discover(Path directory) throws IOException {
        if (directory == null) {
            return empty();
        }
        Path file = directory.resolve(FILE_NAME);
        return Files.isRegularFile(file) ? load(file) : empty();
    }

    public static IsuSettings load(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    public static IsuSettings parse(String toml, String origin) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid " + origin + ": " + errors);
        }
        TomlTable run = result.getTable("run");
        if (run == null) {
            return empty();
        }
        try {
            Optional<Duration> timeout = run.contains("timeout") ? timeout(run) : Optional.empty();
            Optional<Long> maxIterations = Optional.ofNullable(run.getLong("max_iterations"));
            Optional<LogLevel> logLevel = Optional.ofNullable(run.getString("log_level")).map(LogLevel::from);
            Optional<Boolean> cache = Optional.ofNullable(run.getBoolean("cache"));
            maxIterations.filter(n -> n < 0).ifPresent(n -> {
                throw new IllegalArgumentException("run.max_iterations must not be negative");
            });
            return new IsuSettings(timeout, maxIterations, logLevel, cache);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private static Optional<Duration> timeout(TomlTable run) {
        if (run.isLong("timeout")) {
            return Optional.of(Duration.ofMillis(run.getLong("timeout")));
        }
        return DurationParser.parse(run.getString("timeout"));
    }

    /** Copies every value present into {@code builder}. */
    public IsuRunConfiguration.Builder applyTo(IsuRunConfiguration.Builder builder) {
        timeout.ifPresent(value -> builder.timeout(Optional.of(value)));
        maxIterations.ifPresent(builder::maxIterations);
        logLevel.ifPresent(builder::logLevel);
        cache.ifPresent(builder::cache);
        return builder;
    }
}
