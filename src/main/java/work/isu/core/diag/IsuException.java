package work.isu.core.diag;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for every structured pipeline failure: a stable code, a location and a message.
 */
public abstract class IsuException extends RuntimeException {
    private final String code;

    protected IsuException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected IsuException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Location-specific detail fields, merged into {@link #toMap()}. */
    protected abstract Map<String, Object> details();

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", getMessage());
        map.putAll(details());
        return map;
    }
}
