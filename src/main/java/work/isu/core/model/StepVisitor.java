package work.isu.core.model;

/**
 * Exhaustive dispatch over {@link Step} kinds.
 */
public interface StepVisitor<R> {
    R visitSeq(Step.Seq step);

    R visitAssign(Step.Assign step);

    R visitIf(Step.If step);

    R visitLoop(Step.Loop step);

    R visitReturn(Step.Return step);
}
