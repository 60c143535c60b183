package work.isu.core.canon;

import java.util.ArrayList;
import java.util.List;
import work.isu.core.diag.IsuParseException;
import work.isu.core.diag.SourcePos;

/**
 * Splits bracketed inline lists such as {@code [xs: list, i: int]} into trimmed items with positions.
 */
final class InlineList {
    record Item(String text, SourcePos pos) {}

    private InlineList() {}

    static List<Item> split(String value, SourcePos pos, String what) {
        String trimmed = value.trim();
        if (!trimmed.startsWith("[") || !trimmed.endsWith("]")) {
            throw new IsuParseException(pos, what + " must be a bracketed list like [a, b]");
        }
        int base = value.indexOf('[') + 1;
        String inner = trimmed.substring(1, trimmed.length() - 1);
        var items = new ArrayList<Item>();
        if (inner.isBlank()) {
            return items;
        }
        int start = 0;
        while (true) {
            int comma = inner.indexOf(',', start);
            String raw = comma < 0 ? inner.substring(start) : inner.substring(start, comma);
            int lead = 0;
            while (lead < raw.length() && Character.isWhitespace(raw.charAt(lead))) {
                lead++;
            }
            var itemPos = pos.shift(base + start + lead);
            if (raw.isBlank()) {
                throw new IsuParseException(itemPos, "empty entry in " + what);
            }
            items.add(new Item(raw.trim(), itemPos));
            if (comma < 0) {
                return items;
            }
            start = comma + 1;
        }
    }
}
