package work.isu.core.diag;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.isu.core.model.StepId;

/**
 * One static diagnostic. {@code stepId} is absent only for declaration-level errors.
 */
public record StaticError(StaticErrorKind kind, Optional<StepId> stepId, String message) {
    public StaticError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(message, "message");
    }

    public static StaticError at(StaticErrorKind kind, StepId stepId, String message) {
        return new StaticError(kind, Optional.ofNullable(stepId), message);
    }

    public static StaticError global(StaticErrorKind kind, String message) {
        return new StaticError(kind, Optional.empty(), message);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", kind.code());
        map.put("step", stepId.map(StepId::toString).orElse(null));
        map.put("message", message);
        return map;
    }

    @Override
    public String toString() {
        return stepId.map(id -> kind.code() + "@" + id + ": " + message).orElse(kind.code() + ": " + message);
    }
}
