package work.isu.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Program flags. {@code AUTO_ID} is interpreted; other flags are kept verbatim, sorted by key.
 */
public record Meta(boolean autoId, Map<String, String> flags) {
    public Meta {
        flags = Collections.unmodifiableMap(new TreeMap<>(flags == null ? Map.of() : flags));
    }

    public static Meta autoId(boolean autoId) {
        return new Meta(autoId, Map.of());
    }
}
