package work.isu.core.runtime;

/**
 * Unwinds the step walk when a {@code RETURN} executes.
 */
final class ReturnSignal extends RuntimeException {
    private final Object value;

    ReturnSignal(Object value) {
        super("RETURN", null, false, false);
        this.value = value;
    }

    Object value() {
        return value;
    }
}
