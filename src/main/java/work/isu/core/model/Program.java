package work.isu.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical IIR root. Immutable; patches produce a new value.
 */
public record Program(
    Optional<Meta> meta,
    Func func,
    Io io,
    List<Declaration> state,
    List<Declaration> local,
    Step.Seq steps
) {
    public Program {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(func, "func");
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(steps, "steps");
        if (!steps.isRoot()) {
            throw new IllegalArgumentException("Program root must be an unnumbered SEQ");
        }
        state = List.copyOf(state);
        local = List.copyOf(local);
    }

    public boolean autoId() {
        return meta.map(Meta::autoId).orElse(false);
    }

    public List<Declaration> declarations(DeclarationSection section) {
        return switch (section) {
            case INPUT -> io.inputs();
            case OUTPUT -> io.outputs();
            case STATE -> state;
            case LOCAL -> local;
        };
    }

    /** Every declaration in section order (inputs, outputs, state, local). */
    public List<Declaration> allDeclarations() {
        var all = new ArrayList<Declaration>();
        for (DeclarationSection section : DeclarationSection.values()) {
            all.addAll(declarations(section));
        }
        return all;
    }

    /** First declaration with the given name, in section order. */
    public Optional<Declaration> findDeclaration(String name) {
        for (Declaration declaration : allDeclarations()) {
            if (declaration.name().equals(name)) {
                return Optional.of(declaration);
            }
        }
        return Optional.empty();
    }

    public Optional<Step> findStep(StepId id) {
        return StepTree.find(steps, id);
    }

    public Program withSteps(Step.Seq newRoot) {
        return new Program(meta, func, io, state, local, newRoot);
    }
}
