package work.isu.core.model;

import java.util.Locale;
import java.util.Optional;

public enum StepKind {
    SEQ,
    ASSIGN,
    IF,
    LOOP,
    RETURN;

    public String keyword() {
        return name();
    }

    public static Optional<StepKind> fromKeyword(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (StepKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
