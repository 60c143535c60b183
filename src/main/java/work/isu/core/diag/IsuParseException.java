package work.isu.core.diag;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Grammar or structural violation in Isu text. Always carries a source position.
 */
public final class IsuParseException extends IsuException {
    private final SourcePos pos;
    private final String reason;

    public IsuParseException(SourcePos pos, String reason) {
        super("parse_error", format(pos, reason));
        this.pos = Objects.requireNonNull(pos, "pos");
        this.reason = reason;
    }

    public SourcePos pos() {
        return pos;
    }

    public int line() {
        return pos.line();
    }

    public int column() {
        return pos.column();
    }

    /** Human-readable cause without the position prefix. */
    public String reason() {
        return reason;
    }

    @Override
    protected Map<String, Object> details() {
        var map = new LinkedHashMap<String, Object>();
        map.put("line", pos.line());
        map.put("column", pos.column());
        map.put("reason", reason);
        return map;
    }

    private static String format(SourcePos pos, String reason) {
        return String.format("%d:%d %s", pos.line(), pos.column(), reason);
    }
}
