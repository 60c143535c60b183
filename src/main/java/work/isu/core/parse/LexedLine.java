package work.isu.core.parse;

import work.isu.core.diag.SourcePos;

/**
 * One significant source line split at its first colon. {@code head} and {@code tail} are trimmed;
 * {@code tailPos} points at the first character of {@code tail}.
 */
record LexedLine(int number, int indent, String text, String head, String tail, boolean hasColon, SourcePos tailPos) {

    SourcePos pos() {
        return new SourcePos(number, indent);
    }

    boolean is(String keyword) {
        return !hasColon && text.equalsIgnoreCase(keyword);
    }
}
