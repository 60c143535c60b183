package work.isu.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Structural helpers over immutable step trees: ordered walks, lookup and path-copying replacement.
 */
public final class StepTree {
    private StepTree() {}

    /** Visits every numbered step depth-first in canonical order (parents before children). */
    public static void walk(Step root, Consumer<Step> consumer) {
        if (root.id() != null) {
            consumer.accept(root);
        }
        for (List<Step> block : root.blocks()) {
            for (Step child : block) {
                walk(child, consumer);
            }
        }
    }

    public static List<Step> flatten(Step root) {
        var steps = new ArrayList<Step>();
        walk(root, steps::add);
        return steps;
    }

    public static Optional<Step> find(Step root, StepId id) {
        if (id == null) {
            return Optional.empty();
        }
        if (id.equals(root.id())) {
            return Optional.of(root);
        }
        for (List<Step> block : root.blocks()) {
            for (Step child : block) {
                var found = find(child, id);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy of {@code root} in which the step identified by {@code target} is replaced.
     * Subtrees off the path to the target are shared, not copied. Returns empty if the target is absent.
     */
    public static Optional<Step.Seq> replace(Step.Seq root, StepId target, Step replacement) {
        return replaceIn(root, target, replacement).map(Step.Seq.class::cast);
    }

    private static Optional<Step> replaceIn(Step node, StepId target, Step replacement) {
        if (target.equals(node.id())) {
            return Optional.of(replacement);
        }
        var blocks = node.blocks();
        for (int b = 0; b < blocks.size(); b++) {
            var block = blocks.get(b);
            for (int i = 0; i < block.size(); i++) {
                var updated = replaceIn(block.get(i), target, replacement);
                if (updated.isPresent()) {
                    var newBlock = new ArrayList<>(block);
                    newBlock.set(i, updated.get());
                    return Optional.of(withBlock(node, b, newBlock));
                }
            }
        }
        return Optional.empty();
    }

    private static Step withBlock(Step node, int blockIndex, List<Step> block) {
        return node.accept(new StepVisitor<Step>() {
            @Override
            public Step visitSeq(Step.Seq step) {
                return new Step.Seq(step.id(), block);
            }

            @Override
            public Step visitAssign(Step.Assign step) {
                throw new IllegalStateException("ASSIGN has no nested block");
            }

            @Override
            public Step visitIf(Step.If step) {
                return blockIndex == 0
                    ? new Step.If(step.id(), step.cond(), block, step.elseBranch())
                    : new Step.If(step.id(), step.cond(), step.thenBranch(), block);
            }

            @Override
            public Step visitLoop(Step.Loop step) {
                return new Step.Loop(step.id(), step.iter(), step.from(), step.to(), block);
            }

            @Override
            public Step visitReturn(Step.Return step) {
                throw new IllegalStateException("RETURN has no nested block");
            }
        });
    }
}
