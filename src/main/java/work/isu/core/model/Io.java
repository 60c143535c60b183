package work.isu.core.model;

import java.util.List;

/**
 * Ordered input and output declarations.
 */
public record Io(List<Declaration> inputs, List<Declaration> outputs) {
    public Io {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public static Io empty() {
        return new Io(List.of(), List.of());
    }
}
