package work.isu.core.diag;

import java.util.Locale;

public enum StaticErrorKind {
    DUPLICATE_STEP_ID,
    STEP_ID_MISMATCH,
    UNRESOLVED_STEP_REF,
    DUPLICATE_DECLARATION,
    UNDECLARED_VARIABLE,
    UNKNOWN_PARAMETER,
    TYPE_MISMATCH,
    ARITY_MISMATCH,
    RETURN_TYPE_MISMATCH;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
