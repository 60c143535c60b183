package work.isu.core.fixtures;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mismatch between what a fixture expected and what the pipeline produced.
 */
public record TestFail(String fixture, String field, Object expected, Object actual) {

    public String message() {
        return fixture + ": " + field + " expected " + expected + " but was " + actual;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("fixture", fixture);
        map.put("field", field);
        map.put("expected", expected);
        map.put("actual", actual);
        return map;
    }
}
