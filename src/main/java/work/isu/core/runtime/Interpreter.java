package work.isu.core.runtime;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.isu.core.diag.IsuRuntimeException;
import work.isu.core.diag.RuntimeFaultKind;
import work.isu.core.model.Declaration;
import work.isu.core.model.Program;
import work.isu.core.model.Step;
import work.isu.core.model.StepVisitor;
import work.isu.core.model.ValueType;

/**
 * Tree-walking interpreter over canonical IIR. Programs are not validated here; callers that want
 * static guarantees validate first (see {@code IsuPipeline}). The program is never mutated.
 */
public final class Interpreter implements StepVisitor<Void> {
    private final Program program;
    private final ExecutionContext ctx;
    private final Environment env = new Environment();

    private Interpreter(Program program, ExecutionContext ctx) {
        this.program = program;
        this.ctx = ctx;
    }

    public static ExecutionResult interpret(Program program, Map<String, ?> inputs) {
        return interpret(program, inputs, new ExecutionContext());
    }

    /**
     * Runs {@code program} with {@code inputs} bound to its {@code INPUT} declarations.
     *
     * @throws IllegalArgumentException if an input is missing, undeclared or of the wrong type
     * @throws IsuRuntimeException on a runtime fault
     */
    public static ExecutionResult interpret(Program program, Map<String, ?> inputs, ExecutionContext ctx) {
        var interpreter = new Interpreter(program, ctx);
        interpreter.bind(inputs == null ? Map.of() : inputs);
        Optional<Object> returned = Optional.empty();
        try {
            interpreter.block(program.steps().body());
        } catch (ReturnSignal signal) {
            returned = Optional.of(signal.value());
        }
        return new ExecutionResult(
            returned,
            interpreter.env.snapshot(program.io().outputs()),
            interpreter.env.snapshot(program.state())
        );
    }

    private void bind(Map<String, ?> inputs) {
        var declared = new HashSet<String>();
        for (Declaration input : program.io().inputs()) {
            declared.add(input.name());
            if (!inputs.containsKey(input.name())) {
                throw new IllegalArgumentException("Missing input '" + input.name() + "'");
            }
            Object value = Values.normalize(inputs.get(input.name()));
            if (!Values.conforms(value, input.type())) {
                throw new IllegalArgumentException(
                    "Input '" + input.name() + "' must be " + input.type().keyword() + " but got " + Values.typeOf(value).keyword()
                );
            }
            env.declare(input, value);
        }
        for (String name : inputs.keySet()) {
            if (!declared.contains(name)) {
                throw new IllegalArgumentException("Undeclared input '" + name + "'");
            }
        }
        for (Declaration output : program.io().outputs()) {
            env.declare(output, Values.defaultValue(output.type()));
        }
        for (Declaration state : program.state()) {
            env.declare(state, state.initializer().<Object>map(init -> init.value()).orElseGet(() -> Values.defaultValue(state.type())));
        }
        for (Declaration local : program.local()) {
            env.declare(local, Values.defaultValue(local.type()));
        }
    }

    private void block(List<Step> steps) {
        for (Step step : steps) {
            ctx.ensureNotCancelled(step.id());
            step.accept(this);
        }
    }

    private ExprEvaluator evaluator(Step step) {
        return new ExprEvaluator(env, ctx.registry(), step.id());
    }

    @Override
    public Void visitSeq(Step.Seq step) {
        block(step.body());
        return null;
    }

    @Override
    public Void visitAssign(Step.Assign step) {
        Object value = evaluator(step).eval(step.expr());
        env.set(step.target(), value, step.id(), "assign");
        return null;
    }

    @Override
    public Void visitIf(Step.If step) {
        Object cond = evaluator(step).eval(step.cond());
        if (!(cond instanceof Boolean flag)) {
            throw new IsuRuntimeException(RuntimeFaultKind.TYPE_ERROR, step.id(), "if", List.of(cond), "IF condition must be bool");
        }
        block(flag ? step.thenBranch() : step.elseBranch());
        return null;
    }

    @Override
    public Void visitLoop(Step.Loop step) {
        var evaluator = evaluator(step);
        long from = bound(step, evaluator.eval(step.from()), "FROM");
        long to = bound(step, evaluator.eval(step.to()), "TO");
        for (long i = from; i < to; i++) {
            ctx.ensureNotCancelled(step.id());
            ctx.countIteration(step.id());
            env.set(step.iter(), i, step.id(), "loop");
            block(step.body());
        }
        env.set(step.iter(), Math.max(from, to), step.id(), "loop");
        return null;
    }

    @Override
    public Void visitReturn(Step.Return step) {
        Object value = evaluator(step).eval(step.expr());
        var declared = program.func().returnType();
        if (declared != ValueType.ANY && !Values.conforms(value, declared)) {
            throw new IsuRuntimeException(
                RuntimeFaultKind.TYPE_ERROR,
                step.id(),
                "return",
                List.of(value),
                "RETURN value is " + Values.typeOf(value).keyword() + " but the function returns " + declared.keyword()
            );
        }
        throw new ReturnSignal(value);
    }

    private static long bound(Step.Loop step, Object value, String field) {
        if (value instanceof Long bound) {
            return bound;
        }
        throw new IsuRuntimeException(RuntimeFaultKind.TYPE_ERROR, step.id(), "loop", List.of(value), "LOOP " + field + " must be int");
    }
}
