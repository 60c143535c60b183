package work.isu.core.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed registry of standard functions callable through {@code (call NAME ...)}.
 * Each entry names exactly one operation; parameter sets list the accepted argument
 * kinds per position, the last set repeating for variadic entries.
 */
public enum StdFunction {
    LEN(ValueType.INT, false, EnumSet.of(ValueType.LIST, ValueType.STRING, ValueType.MAP)),
    PUSH(ValueType.LIST, false, EnumSet.of(ValueType.LIST), EnumSet.allOf(ValueType.class)),
    POP(ValueType.LIST, false, EnumSet.of(ValueType.LIST)),
    SLICE(ValueType.ANY, false, EnumSet.of(ValueType.LIST, ValueType.STRING), EnumSet.of(ValueType.INT), EnumSet.of(ValueType.INT)),
    HAS(ValueType.BOOL, false, EnumSet.of(ValueType.MAP), EnumSet.of(ValueType.STRING)),
    GET(ValueType.ANY, false, EnumSet.of(ValueType.MAP), EnumSet.of(ValueType.STRING)),
    SET(ValueType.MAP, false, EnumSet.of(ValueType.MAP), EnumSet.of(ValueType.STRING), EnumSet.allOf(ValueType.class)),
    SPLIT(ValueType.LIST, false, EnumSet.of(ValueType.STRING), EnumSet.of(ValueType.STRING)),
    JOIN(ValueType.STRING, false, EnumSet.of(ValueType.LIST), EnumSet.of(ValueType.STRING)),
    LOWER(ValueType.STRING, false, EnumSet.of(ValueType.STRING)),
    ABS(ValueType.INT, false, EnumSet.of(ValueType.INT)),
    MIN(ValueType.INT, true, EnumSet.of(ValueType.INT)),
    MAX(ValueType.INT, true, EnumSet.of(ValueType.INT));

    private final ValueType resultType;
    private final boolean variadic;
    private final List<Set<ValueType>> parameters;

    @SafeVarargs
    StdFunction(ValueType resultType, boolean variadic, Set<ValueType>... parameters) {
        this.resultType = resultType;
        this.variadic = variadic;
        this.parameters = List.of(parameters);
    }

    public int minArity() {
        return parameters.size();
    }

    /** Upper arity bound, {@link Integer#MAX_VALUE} for variadic entries. */
    public int maxArity() {
        return variadic ? Integer.MAX_VALUE : parameters.size();
    }

    public boolean acceptsArity(int count) {
        return count >= minArity() && count <= maxArity();
    }

    public Set<ValueType> parameterKinds(int index) {
        if (index < parameters.size()) {
            return parameters.get(index);
        }
        return parameters.get(parameters.size() - 1);
    }

    /**
     * Static result type given the inferred argument types. {@code SLICE} keeps the kind of
     * its first argument; every other entry has a fixed result type.
     */
    public ValueType resultType(List<ValueType> argumentTypes) {
        if (this == SLICE && !argumentTypes.isEmpty() && argumentTypes.get(0) != ValueType.ANY) {
            return argumentTypes.get(0);
        }
        return resultType;
    }

    public static Optional<StdFunction> fromName(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.toUpperCase(Locale.ROOT);
        for (StdFunction fn : values()) {
            if (fn.name().equals(normalized)) {
                return Optional.of(fn);
            }
        }
        return Optional.empty();
    }
}
