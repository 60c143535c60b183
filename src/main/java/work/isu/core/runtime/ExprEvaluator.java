package work.isu.core.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.isu.core.diag.IsuRuntimeException;
import work.isu.core.diag.RuntimeFaultKind;
import work.isu.core.model.BinaryOp;
import work.isu.core.model.Expr;
import work.isu.core.model.ExprVisitor;
import work.isu.core.model.StepId;

/**
 * Strict evaluation of one step's expressions. The owning step ID travels with the evaluator so
 * every fault names the step that triggered it.
 */
final class ExprEvaluator implements ExprVisitor<Object> {
    private final Environment env;
    private final FunctionRegistry registry;
    private final StepId stepId;

    ExprEvaluator(Environment env, FunctionRegistry registry, StepId stepId) {
        this.env = env;
        this.registry = registry;
        this.stepId = stepId;
    }

    Object eval(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public Object visitConst(Expr.Const node) {
        return node.value();
    }

    @Override
    public Object visitVar(Expr.Var node) {
        return env.get(node.name(), stepId);
    }

    @Override
    public Object visitBinary(Expr.Binary node) {
        Object left = eval(node.left());
        Object right = eval(node.right());
        BinaryOp op = node.op();
        switch (op) {
            case EQ:
                return left.equals(right);
            case NE:
                return !left.equals(right);
            case LT:
            case LE:
            case GT:
            case GE:
                return order(op, left, right);
            case ADD:
                if (left instanceof String l && right instanceof String r) {
                    return l + r;
                }
                return arithmetic(op, left, right);
            default:
                return arithmetic(op, left, right);
        }
    }

    @Override
    public Object visitIndex(Expr.Index node) {
        Object target = eval(node.target());
        Object index = eval(node.index());
        if (target instanceof List<?> list && index instanceof Long i) {
            if (i < 0 || i >= list.size()) {
                throw fault(RuntimeFaultKind.INDEX_OUT_OF_RANGE, "index", target, index, "index " + i + " outside [0, " + list.size() + ")");
            }
            return list.get(i.intValue());
        }
        if (target instanceof String text && index instanceof Long i) {
            if (i < 0 || i >= text.length()) {
                throw fault(RuntimeFaultKind.INDEX_OUT_OF_RANGE, "index", target, index, "index " + i + " outside [0, " + text.length() + ")");
            }
            return String.valueOf(text.charAt(i.intValue()));
        }
        if (target instanceof Map<?, ?> map && index instanceof String key) {
            if (!map.containsKey(key)) {
                throw fault(RuntimeFaultKind.MISSING_KEY, "index", target, index, "key '" + key + "' is not present");
            }
            return map.get(key);
        }
        throw fault(RuntimeFaultKind.TYPE_ERROR, "index", target, index, "cannot index " + Values.typeOf(target).keyword()
            + " with " + Values.typeOf(index).keyword());
    }

    @Override
    public Object visitCall(Expr.Call node) {
        var args = new ArrayList<Object>(node.args().size());
        for (Expr arg : node.args()) {
            args.add(eval(arg));
        }
        var site = new CallSite(stepId, node.function(), args);
        if (!node.function().acceptsArity(args.size())) {
            throw site.fault(RuntimeFaultKind.TYPE_ERROR, node.function().name() + " called with " + args.size() + " argument(s)");
        }
        var entry = registry.get(node.function());
        if (entry == null) {
            throw new IllegalStateException("Standard function not registered: " + node.function());
        }
        return entry.impl().invoke(site);
    }

    private Object order(BinaryOp op, Object left, Object right) {
        int cmp;
        if (left instanceof Long l && right instanceof Long r) {
            cmp = Long.compare(l, r);
        } else if (left instanceof String l && right instanceof String r) {
            cmp = l.compareTo(r);
        } else {
            throw fault(RuntimeFaultKind.TYPE_ERROR, op.tag(), left, right, op.tag() + " needs two ints or two strings");
        }
        switch (op) {
            case LT:
                return cmp < 0;
            case LE:
                return cmp <= 0;
            case GT:
                return cmp > 0;
            default:
                return cmp >= 0;
        }
    }

    private Object arithmetic(BinaryOp op, Object left, Object right) {
        if (!(left instanceof Long l) || !(right instanceof Long r)) {
            throw fault(RuntimeFaultKind.TYPE_ERROR, op.tag(), left, right, op.tag() + " needs int operands");
        }
        try {
            switch (op) {
                case ADD:
                    return Math.addExact(l, r);
                case SUB:
                    return Math.subtractExact(l, r);
                case MUL:
                    return Math.multiplyExact(l, r);
                case DIV:
                    if (r == 0) {
                        throw fault(RuntimeFaultKind.DIVISION_BY_ZERO, op.tag(), left, right, "division by zero");
                    }
                    if (l == Long.MIN_VALUE && r == -1) {
                        throw fault(RuntimeFaultKind.ARITHMETIC_OVERFLOW, op.tag(), left, right, "int overflow");
                    }
                    return l / r;
                case MOD:
                    if (r == 0) {
                        throw fault(RuntimeFaultKind.DIVISION_BY_ZERO, op.tag(), left, right, "modulo by zero");
                    }
                    return l % r;
                default:
                    throw new IllegalStateException("Not an arithmetic operator: " + op);
            }
        } catch (ArithmeticException ex) {
            throw fault(RuntimeFaultKind.ARITHMETIC_OVERFLOW, op.tag(), left, right, "int overflow");
        }
    }

    private IsuRuntimeException fault(RuntimeFaultKind kind, String operator, Object left, Object right, String message) {
        return new IsuRuntimeException(kind, stepId, operator, List.of(left, right), message);
    }
}
