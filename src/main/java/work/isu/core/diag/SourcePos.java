package work.isu.core.diag;

import java.util.Comparator;

/**
 * 1-based line/column position in Isu source text.
 */
public record SourcePos(int line, int column) implements Comparable<SourcePos> {
    /** Position used for nodes that were not read from text. */
    public static final SourcePos SYNTHETIC = new SourcePos(0, 0);

    private static final Comparator<SourcePos> ORDER =
        Comparator.comparingInt(SourcePos::line).thenComparingInt(SourcePos::column);

    public SourcePos shift(int columns) {
        return new SourcePos(line, column + columns);
    }

    @Override
    public int compareTo(SourcePos other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
