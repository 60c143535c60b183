package work.isu.core.diag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Carries one or more {@link StaticError} diagnostics out of canonicalization or patching.
 */
public final class IsuStaticException extends IsuException {
    private final List<StaticError> errors;

    public IsuStaticException(List<StaticError> errors) {
        super("static_error", summarize(errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("IsuStaticException needs at least one error");
        }
        this.errors = List.copyOf(errors);
    }

    public IsuStaticException(StaticError error) {
        this(List.of(error));
    }

    public List<StaticError> errors() {
        return errors;
    }

    public StaticError first() {
        return errors.get(0);
    }

    @Override
    protected Map<String, Object> details() {
        var list = new ArrayList<Map<String, Object>>();
        for (StaticError error : errors) {
            list.add(error.toMap());
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("errors", list);
        return map;
    }

    private static String summarize(List<StaticError> errors) {
        return errors.stream().map(StaticError::toString).collect(Collectors.joining("; "));
    }
}
