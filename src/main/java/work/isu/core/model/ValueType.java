package work.isu.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of primitive value kinds known to the validator and the interpreter.
 */
public enum ValueType {
    INT,
    BOOL,
    STRING,
    LIST,
    MAP,
    ANY;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean compatibleWith(ValueType other) {
        return this == ANY || other == ANY || this == other;
    }

    public static Optional<ValueType> fromKeyword(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ValueType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
