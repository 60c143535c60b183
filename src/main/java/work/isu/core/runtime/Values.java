package work.isu.core.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.isu.core.model.ValueType;

/**
 * Runtime value helpers. Isu values are {@link Long}, {@link Boolean}, {@link String}, and
 * unmodifiable {@link List} / {@link Map} (string keys) built from those.
 */
public final class Values {
    private Values() {}

    public static ValueType typeOf(Object value) {
        if (value instanceof Long) {
            return ValueType.INT;
        }
        if (value instanceof Boolean) {
            return ValueType.BOOL;
        }
        if (value instanceof String) {
            return ValueType.STRING;
        }
        if (value instanceof List<?>) {
            return ValueType.LIST;
        }
        if (value instanceof Map<?, ?>) {
            return ValueType.MAP;
        }
        throw new IllegalArgumentException("Not an Isu value: " + describe(value));
    }

    public static boolean conforms(Object value, ValueType type) {
        return type == ValueType.ANY || typeOf(value) == type;
    }

    public static Object defaultValue(ValueType type) {
        switch (type) {
            case BOOL:
                return Boolean.FALSE;
            case STRING:
                return "";
            case LIST:
                return List.of();
            case MAP:
                return Map.of();
            default:
                return 0L;
        }
    }

    /**
     * Converts host values into Isu values: smaller integral boxes widen to {@link Long},
     * collections are copied into unmodifiable ones. Anything else is rejected.
     */
    public static Object normalize(Object value) {
        if (value instanceof Long || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (Object item : list) {
                copy.add(normalize(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Map keys must be strings: " + describe(entry.getKey()));
                }
                copy.put(key, normalize(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        throw new IllegalArgumentException("Unsupported value: " + describe(value));
    }

    static List<Object> append(List<?> list, Object item) {
        var copy = new ArrayList<Object>(list.size() + 1);
        copy.addAll(list);
        copy.add(item);
        return Collections.unmodifiableList(copy);
    }

    static Map<String, Object> put(Map<?, ?> map, String key, Object value) {
        var copy = new LinkedHashMap<String, Object>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put((String) entry.getKey(), entry.getValue());
        }
        copy.put(key, value);
        return Collections.unmodifiableMap(copy);
    }

    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value.getClass().getSimpleName() + " " + value;
    }
}
