package work.isu.core.model;

import java.util.List;
import java.util.Objects;

public record Func(String name, List<String> params, ValueType returnType) {
    public Func {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        params = List.copyOf(params);
    }
}
