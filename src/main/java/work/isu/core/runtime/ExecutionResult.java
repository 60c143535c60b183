package work.isu.core.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a completed interpretation.
 *
 * @param returnValue value of the executed {@code RETURN}, empty if the steps ran to completion
 * @param outputs final {@code OUTPUT} bindings in declaration order
 * @param state final {@code STATE} bindings in declaration order
 */
public record ExecutionResult(Optional<Object> returnValue, Map<String, Object> outputs, Map<String, Object> state) {
    public ExecutionResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("returned", returnValue.isPresent());
        map.put("return", returnValue.orElse(null));
        map.put("outputs", outputs);
        map.put("state", state);
        return map;
    }
}
