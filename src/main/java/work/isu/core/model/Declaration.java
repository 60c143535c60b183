package work.isu.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed variable declaration. Only {@code STATE} declarations may carry an initializer.
 */
public record Declaration(String name, ValueType type, Optional<Expr.Const> initializer) {
    public Declaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(initializer, "initializer");
    }

    public static Declaration of(String name, ValueType type) {
        return new Declaration(name, type, Optional.empty());
    }
}
