package work.isu.core.diag;

import java.util.Locale;

public enum RuntimeFaultKind {
    DIVISION_BY_ZERO,
    INDEX_OUT_OF_RANGE,
    MISSING_KEY,
    ARITHMETIC_OVERFLOW,
    TYPE_ERROR,
    UNBOUND_VARIABLE,
    CANCELLED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
