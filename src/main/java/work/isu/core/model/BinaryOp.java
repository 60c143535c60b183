package work.isu.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed binary operator tags. Arithmetic tags yield {@code int}, comparison tags yield {@code bool}.
 */
public enum BinaryOp {
    ADD(false),
    SUB(false),
    MUL(false),
    DIV(false),
    MOD(false),
    EQ(true),
    NE(true),
    LT(true),
    LE(true),
    GT(true),
    GE(true);

    private final boolean comparison;

    BinaryOp(boolean comparison) {
        this.comparison = comparison;
    }

    public boolean isComparison() {
        return comparison;
    }

    public boolean isOrdering() {
        return comparison && this != EQ && this != NE;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<BinaryOp> fromTag(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.toUpperCase(Locale.ROOT);
        for (BinaryOp op : values()) {
            if (op.name().equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
