package work.isu.core.parse;

import java.util.Objects;
import work.isu.core.diag.SourcePos;

public record RawField(StepField field, SourcePos pos, RawValue value) {
    public RawField {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }
}
