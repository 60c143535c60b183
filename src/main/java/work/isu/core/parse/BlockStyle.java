package work.isu.core.parse;

/**
 * Surface delimiter used for a block on input. Canonical IIR does not retain it.
 */
public enum BlockStyle {
    BEGIN_END("BEGIN", "END"),
    BRACES("{", "}");

    private final String opener;
    private final String closer;

    BlockStyle(String opener, String closer) {
        this.opener = opener;
        this.closer = closer;
    }

    public String opener() {
        return opener;
    }

    public String closer() {
        return closer;
    }
}
