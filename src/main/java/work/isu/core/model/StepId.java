package work.isu.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Hierarchical step identifier such as {@code S2} or {@code S2_1}.
 * Ordering follows structural position: a prefix sorts before its extensions,
 * siblings sort by numeric suffix.
 */
public record StepId(List<Integer> segments) implements Comparable<StepId> {
    private static final Pattern SYNTAX = Pattern.compile("S[1-9][0-9]*(?:_[1-9][0-9]*)*");

    public StepId {
        Objects.requireNonNull(segments, "segments");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Step ID needs at least one segment");
        }
        for (Integer segment : segments) {
            if (segment == null || segment < 1) {
                throw new IllegalArgumentException("Step ID segments must be positive: " + segments);
            }
        }
        segments = List.copyOf(segments);
    }

    public static StepId top(int position) {
        return new StepId(List.of(position));
    }

    public static boolean isValid(String raw) {
        return raw != null && SYNTAX.matcher(raw).matches();
    }

    public static Optional<StepId> tryParse(String raw) {
        if (!isValid(raw)) {
            return Optional.empty();
        }
        var parts = raw.substring(1).split("_");
        var segments = new ArrayList<Integer>(parts.length);
        for (String part : parts) {
            try {
                segments.add(Integer.parseInt(part));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.of(new StepId(segments));
    }

    public static StepId parse(String raw) {
        return tryParse(raw).orElseThrow(() -> new IllegalArgumentException("Malformed step ID: " + raw));
    }

    public StepId child(int position) {
        var next = new ArrayList<>(segments);
        next.add(position);
        return new StepId(next);
    }

    public int depth() {
        return segments.size();
    }

    public boolean isAncestorOf(StepId other) {
        if (other.segments.size() <= segments.size()) {
            return false;
        }
        return other.segments.subList(0, segments.size()).equals(segments);
    }

    @Override
    public int compareTo(StepId other) {
        int shared = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < shared; i++) {
            int cmp = Integer.compare(segments.get(i), other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public String toString() {
        var builder = new StringBuilder("S");
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                builder.append('_');
            }
            builder.append(segments.get(i));
        }
        return builder.toString();
    }
}
