package work.isu.core.parse;

import java.util.ArrayList;
import java.util.List;
import work.isu.core.diag.SourcePos;

/**
 * Splits Isu text into significant lines. Blank lines and lines whose first non-space
 * character is {@code ;} are dropped; indentation is recorded for diagnostics only.
 */
final class IsuLexer {
    private IsuLexer() {}

    static List<LexedLine> lex(String text) {
        var lines = new ArrayList<LexedLine>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        String[] raw = text.split("\r\n|\r|\n", -1);
        for (int index = 0; index < raw.length; index++) {
            String line = raw[index];
            int start = firstNonSpace(line);
            if (start < 0 || line.charAt(start) == ';') {
                continue;
            }
            String content = line.substring(start).stripTrailing();
            int number = index + 1;
            int column = start + 1;
            int colon = content.indexOf(':');
            if (colon < 0) {
                lines.add(new LexedLine(number, column, content, content, "", false, new SourcePos(number, column + content.length())));
                continue;
            }
            String head = content.substring(0, colon).trim();
            String afterColon = content.substring(colon + 1);
            int tailOffset = colon + 1 + Math.max(firstNonSpace(afterColon), 0);
            String tail = afterColon.trim();
            lines.add(new LexedLine(number, column, content, head, tail, true, new SourcePos(number, column + tailOffset)));
        }
        return lines;
    }

    private static int firstNonSpace(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (!Character.isWhitespace(line.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
