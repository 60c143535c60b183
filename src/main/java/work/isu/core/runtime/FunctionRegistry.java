package work.isu.core.runtime;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import work.isu.core.model.StdFunction;

/**
 * Binds standard-function names to implementations. The shared {@link #standard()} registry is
 * sealed after bootstrap; callers that need other bindings build their own instance.
 */
public final class FunctionRegistry {
    private static final FunctionRegistry STANDARD = StandardLibrary.register(new FunctionRegistry()).seal();

    private final Map<StdFunction, Entry> functions = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    public static FunctionRegistry standard() {
        return STANDARD;
    }

    /** A fresh, unsealed registry holding the standard bindings. */
    public static FunctionRegistry standardCopy() {
        return StandardLibrary.register(new FunctionRegistry());
    }

    /**
     * @throws IllegalStateException once the registry is sealed
     */
    public FunctionRegistry register(StdFunction function, StdFunctionImpl impl) {
        if (sealed) {
            throw new IllegalStateException("Function registry is sealed; cannot rebind " + function);
        }
        functions.put(function, new Entry(function, impl));
        return this;
    }

    public FunctionRegistry seal() {
        sealed = true;
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    public Entry get(StdFunction function) {
        return functions.get(function);
    }

    /** Registry entries missing an implementation. */
    public EnumSet<StdFunction> unbound() {
        var missing = EnumSet.allOf(StdFunction.class);
        missing.removeAll(functions.keySet());
        return missing;
    }

    public Map<StdFunction, Entry> entries() {
        return Collections.unmodifiableMap(functions);
    }

    public record Entry(StdFunction function, StdFunctionImpl impl) {
        public Entry {
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(impl, "impl");
        }
    }
}
