package work.isu.core.canon;

import work.isu.core.model.StepId;

/**
 * Traversal context for positional step numbering under one parent. Blocks that share a parent
 * (an {@code IF}'s then and else branches) share the scope, so their children never collide.
 */
final class IdScope {
    private final StepId parent;
    private int position = 0;

    private IdScope(StepId parent) {
        this.parent = parent;
    }

    static IdScope topLevel() {
        return new IdScope(null);
    }

    static IdScope under(StepId parent) {
        return new IdScope(parent);
    }

    StepId next() {
        position++;
        return parent == null ? StepId.top(position) : parent.child(position);
    }
}
