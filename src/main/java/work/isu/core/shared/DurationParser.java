package work.isu.core.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses user-friendly durations: {@code 250ms}, {@code 30s}, {@code 2m}, {@code 1h} and compounds
 * such as {@code 1m30s}. A bare number is milliseconds.
 */
public final class DurationParser {
    private static final Pattern PART = Pattern.compile("(\\d+)(ms|s|m|h)");
    private static final Pattern BARE = Pattern.compile("\\d+");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        if (BARE.matcher(text).matches()) {
            return Optional.of(Duration.ofMillis(Long.parseLong(text)));
        }
        var matcher = PART.matcher(text);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                break;
            }
            long amount = Long.parseLong(matcher.group(1));
            total = total.plus(unit(amount, matcher.group(2)));
            consumed = matcher.end();
        }
        if (consumed == 0 || consumed != text.length()) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        return Optional.of(total);
    }

    private static Duration unit(long amount, String suffix) {
        switch (suffix) {
            case "ms":
                return Duration.ofMillis(amount);
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            default:
                return Duration.ofHours(amount);
        }
    }
}
