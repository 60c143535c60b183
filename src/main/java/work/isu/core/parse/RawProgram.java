package work.isu.core.parse;

import java.util.Objects;
import java.util.Optional;
import work.isu.core.model.Program;

/**
 * Raw parse tree of a whole Isu program. {@code steps} is the root {@code SEQ} with its
 * {@code BODY} field holding the top-level steps.
 */
public record RawProgram(
    Optional<RawSection<RawEntry>> meta,
    RawSection<RawEntry> func,
    RawSection<RawEntry> io,
    RawSection<RawDecl> state,
    RawSection<RawDecl> local,
    RawStep steps
) {
    public RawProgram {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(func, "func");
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(steps, "steps");
    }

    /** Raw view of a canonical program; canonicalizing it yields the same program. */
    public static RawProgram of(Program program) {
        return RawLowering.lower(program);
    }
}
