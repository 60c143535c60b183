package work.isu.core.patch;

import java.util.Objects;
import work.isu.core.model.Program;

/**
 * Accepted patch: the new program and its canonical text.
 */
public record PatchOutcome(Program program, String canonicalText) {
    public PatchOutcome {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(canonicalText, "canonicalText");
    }
}
