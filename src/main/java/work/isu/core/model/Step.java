package work.isu.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Closed set of step kinds. Every step carries a {@link StepId} except the implicit root {@link Seq}.
 * Record components are declared in canonical field order.
 */
public sealed interface Step permits Step.Seq, Step.Assign, Step.If, Step.Loop, Step.Return {

    StepId id();

    StepKind kind();

    <R> R accept(StepVisitor<R> visitor);

    /** Nested blocks in canonical order (then before else for {@link If}). */
    List<List<Step>> blocks();

    record Seq(StepId id, List<Step> body) implements Step {
        public Seq {
            body = List.copyOf(body);
        }

        public static Seq root(List<Step> body) {
            return new Seq(null, body);
        }

        public boolean isRoot() {
            return id == null;
        }

        @Override
        public StepKind kind() {
            return StepKind.SEQ;
        }

        @Override
        public List<List<Step>> blocks() {
            return List.of(body);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitSeq(this);
        }
    }

    record Assign(StepId id, String target, Expr expr) implements Step {
        public Assign {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public StepKind kind() {
            return StepKind.ASSIGN;
        }

        @Override
        public List<List<Step>> blocks() {
            return List.of();
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    record If(StepId id, Expr cond, List<Step> thenBranch, List<Step> elseBranch) implements Step {
        public If {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(cond, "cond");
            thenBranch = List.copyOf(thenBranch);
            elseBranch = List.copyOf(elseBranch);
        }

        @Override
        public StepKind kind() {
            return StepKind.IF;
        }

        @Override
        public List<List<Step>> blocks() {
            return List.of(thenBranch, elseBranch);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record Loop(StepId id, String iter, Expr from, Expr to, List<Step> body) implements Step {
        public Loop {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(iter, "iter");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            body = List.copyOf(body);
        }

        @Override
        public StepKind kind() {
            return StepKind.LOOP;
        }

        @Override
        public List<List<Step>> blocks() {
            return List.of(body);
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitLoop(this);
        }
    }

    record Return(StepId id, Expr expr) implements Step {
        public Return {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public StepKind kind() {
            return StepKind.RETURN;
        }

        @Override
        public List<List<Step>> blocks() {
            return List.of();
        }

        @Override
        public <R> R accept(StepVisitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }
}
