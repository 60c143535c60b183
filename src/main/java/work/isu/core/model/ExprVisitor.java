package work.isu.core.model;

/**
 * Exhaustive dispatch over {@link Expr} kinds; adding a kind breaks every implementor.
 */
public interface ExprVisitor<R> {
    R visitConst(Expr.Const node);

    R visitVar(Expr.Var node);

    R visitBinary(Expr.Binary node);

    R visitIndex(Expr.Index node);

    R visitCall(Expr.Call node);
}
