package work.isu.core.validate;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import work.isu.core.diag.StaticErrorKind;
import work.isu.core.model.BinaryOp;
import work.isu.core.model.Expr;
import work.isu.core.model.ExprVisitor;
import work.isu.core.model.StepId;
import work.isu.core.model.ValueType;

/**
 * Shallow, local type inference for one expression. Problems are reported to the owning
 * {@link Validator} against {@code stepId}; inference continues with {@code any} after a problem
 * so one bad operand is reported once.
 */
final class TypeChecker implements ExprVisitor<ValueType> {
    private static final Set<ValueType> ORDERED = EnumSet.of(ValueType.INT, ValueType.STRING, ValueType.ANY);

    private final Map<String, ValueType> symbols;
    private final StepId stepId;
    private final Validator.Sink sink;

    TypeChecker(Map<String, ValueType> symbols, StepId stepId, Validator.Sink sink) {
        this.symbols = symbols;
        this.stepId = stepId;
        this.sink = sink;
    }

    ValueType infer(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public ValueType visitConst(Expr.Const node) {
        return node.type();
    }

    @Override
    public ValueType visitVar(Expr.Var node) {
        var type = symbols.get(node.name());
        if (type == null) {
            sink.report(StaticErrorKind.UNDECLARED_VARIABLE, stepId, "variable '" + node.name() + "' is not declared");
            return ValueType.ANY;
        }
        return type;
    }

    @Override
    public ValueType visitBinary(Expr.Binary node) {
        var left = infer(node.left());
        var right = infer(node.right());
        var op = node.op();
        if (op == BinaryOp.EQ || op == BinaryOp.NE) {
            if (!left.compatibleWith(right)) {
                mismatch(op.tag() + " compares " + left.keyword() + " to " + right.keyword());
            }
            return ValueType.BOOL;
        }
        if (op.isOrdering()) {
            if (!left.compatibleWith(right) || !ORDERED.contains(left) || !ORDERED.contains(right)) {
                mismatch(op.tag() + " cannot order " + left.keyword() + " and " + right.keyword());
            }
            return ValueType.BOOL;
        }
        if (op == BinaryOp.ADD && (left == ValueType.STRING || right == ValueType.STRING)) {
            if (!left.compatibleWith(right)) {
                mismatch("add mixes " + left.keyword() + " and " + right.keyword());
            }
            return ValueType.STRING;
        }
        if (!left.compatibleWith(ValueType.INT) || !right.compatibleWith(ValueType.INT)) {
            mismatch(op.tag() + " expects int operands but got " + left.keyword() + " and " + right.keyword());
            return ValueType.INT;
        }
        if (op == BinaryOp.ADD && left == ValueType.ANY && right == ValueType.ANY) {
            return ValueType.ANY;
        }
        return ValueType.INT;
    }

    @Override
    public ValueType visitIndex(Expr.Index node) {
        var target = infer(node.target());
        var index = infer(node.index());
        switch (target) {
            case LIST:
                expect(index, ValueType.INT, "list index");
                return ValueType.ANY;
            case STRING:
                expect(index, ValueType.INT, "string index");
                return ValueType.STRING;
            case MAP:
                expect(index, ValueType.STRING, "map key");
                return ValueType.ANY;
            case ANY:
                return ValueType.ANY;
            default:
                mismatch("cannot index into " + target.keyword());
                return ValueType.ANY;
        }
    }

    @Override
    public ValueType visitCall(Expr.Call node) {
        var function = node.function();
        var argTypes = new ArrayList<ValueType>(node.args().size());
        for (Expr arg : node.args()) {
            argTypes.add(infer(arg));
        }
        if (!function.acceptsArity(argTypes.size())) {
            sink.report(
                StaticErrorKind.ARITY_MISMATCH,
                stepId,
                function.name() + " expects " + arityText(function.minArity(), function.maxArity()) + " but got " + argTypes.size()
            );
            return function.resultType(argTypes);
        }
        for (int i = 0; i < argTypes.size(); i++) {
            var actual = argTypes.get(i);
            var accepted = function.parameterKinds(i);
            if (actual != ValueType.ANY && !accepted.contains(actual)) {
                mismatch(function.name() + " argument " + (i + 1) + " cannot be " + actual.keyword());
            }
        }
        return function.resultType(argTypes);
    }

    private void expect(ValueType actual, ValueType expected, String what) {
        if (!actual.compatibleWith(expected)) {
            mismatch(what + " must be " + expected.keyword() + " but is " + actual.keyword());
        }
    }

    private void mismatch(String message) {
        sink.report(StaticErrorKind.TYPE_MISMATCH, stepId, message);
    }

    private static String arityText(int min, int max) {
        if (max == Integer.MAX_VALUE) {
            return "at least " + min + " argument(s)";
        }
        return min == max ? min + " argument(s)" : min + " to " + max + " arguments";
    }
}
