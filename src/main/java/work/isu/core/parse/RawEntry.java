package work.isu.core.parse;

import work.isu.core.diag.SourcePos;

/**
 * {@code KEY: value} line from a mapping section ({@code META}, {@code FUNC}, {@code IO}).
 */
public record RawEntry(String key, String value, SourcePos pos, SourcePos valuePos) {}
