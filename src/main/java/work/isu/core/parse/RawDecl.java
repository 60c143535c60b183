package work.isu.core.parse;

import java.util.Optional;
import work.isu.core.diag.SourcePos;

/**
 * {@code - name: type [= literal]} line from {@code STATE} or {@code LOCAL}.
 */
public record RawDecl(String name, String type, Optional<String> initializer, SourcePos pos, SourcePos typePos) {}
