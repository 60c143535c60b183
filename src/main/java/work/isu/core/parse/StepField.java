package work.isu.core.parse;

import java.util.Locale;
import java.util.Optional;

/**
 * Field keywords allowed inside a step, grouped by the kind of value they carry.
 */
public enum StepField {
    TARGET(Shape.NAME),
    ITER(Shape.NAME),
    EXPR(Shape.EXPRESSION),
    COND(Shape.EXPRESSION),
    FROM(Shape.EXPRESSION),
    TO(Shape.EXPRESSION),
    THEN(Shape.BLOCK),
    ELSE(Shape.BLOCK),
    BODY(Shape.BLOCK);

    public enum Shape {
        NAME,
        EXPRESSION,
        BLOCK
    }

    private final Shape shape;

    StepField(Shape shape) {
        this.shape = shape;
    }

    public Shape shape() {
        return shape;
    }

    public static Optional<StepField> fromKeyword(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (StepField field : values()) {
            if (field.name().equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
