package work.isu.core.parse;

import java.util.List;
import work.isu.core.diag.SourcePos;

/**
 * Section header position plus its parsed lines.
 */
public record RawSection<T>(String name, SourcePos pos, List<T> items) {
    public RawSection {
        items = List.copyOf(items);
    }
}
