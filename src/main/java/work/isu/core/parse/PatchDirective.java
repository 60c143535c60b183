package work.isu.core.parse;

import java.util.Objects;
import work.isu.core.diag.SourcePos;
import work.isu.core.model.StepId;

/**
 * Parsed {@code PATCH} block: one {@code REPLACE <StepID>:} directive and its replacement step.
 */
public record PatchDirective(StepId target, SourcePos pos, RawStep replacement) {
    public PatchDirective {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(replacement, "replacement");
    }
}
