package work.isu.core.parse;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.isu.core.diag.SourcePos;
import work.isu.core.model.Step;
import work.isu.core.model.StepId;
import work.isu.core.model.StepKind;

/**
 * Permissive step node: fields in input order, possibly missing, duplicated or misplaced.
 * The canonicalizer decides whether the combination is legal.
 */
public record RawStep(StepKind kind, Optional<StepId> id, SourcePos pos, List<RawField> fields) {
    public RawStep {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        fields = List.copyOf(fields);
    }

    public static RawStep of(Step step) {
        return RawLowering.lower(step);
    }
}
