package work.isu.core.parse;

import java.util.List;
import java.util.Objects;
import work.isu.core.diag.SourcePos;
import work.isu.core.model.Expr;

/**
 * Value of one raw step field, shaped by its {@link StepField}.
 */
public sealed interface RawValue permits RawValue.Name, RawValue.Expression, RawValue.Block {

    record Name(String name, SourcePos pos) implements RawValue {
        public Name {
            Objects.requireNonNull(name, "name");
        }
    }

    record Expression(Expr expr, SourcePos pos) implements RawValue {
        public Expression {
            Objects.requireNonNull(expr, "expr");
        }
    }

    record Block(BlockStyle style, SourcePos pos, List<RawStep> steps) implements RawValue {
        public Block {
            Objects.requireNonNull(style, "style");
            steps = List.copyOf(steps);
        }
    }
}
