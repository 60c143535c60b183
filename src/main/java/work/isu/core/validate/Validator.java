package work.isu.core.validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import work.isu.core.diag.StaticError;
import work.isu.core.diag.StaticErrorKind;
import work.isu.core.model.Declaration;
import work.isu.core.model.DeclarationSection;
import work.isu.core.model.Expr;
import work.isu.core.model.Program;
import work.isu.core.model.Step;
import work.isu.core.model.StepId;
import work.isu.core.model.StepTree;
import work.isu.core.model.StepVisitor;
import work.isu.core.model.ValueType;

/**
 * Static checks over canonical IIR. Every check runs; errors come back in discovery order:
 * declarations first, then steps depth-first, then external step references.
 */
public final class Validator {

    /** Receives diagnostics while checks run. */
    interface Sink {
        void report(StaticErrorKind kind, StepId stepId, String message);
    }

    private final Program program;
    private final List<StaticError> errors = new ArrayList<>();
    private final Map<String, ValueType> symbols = new HashMap<>();
    private final Sink sink = (kind, stepId, message) -> errors.add(StaticError.at(kind, stepId, message));

    private Validator(Program program) {
        this.program = program;
    }

    public static List<StaticError> validate(Program program) {
        return validate(program, List.of());
    }

    /** Also checks that every id in {@code references} names a step of {@code program}. */
    public static List<StaticError> validate(Program program, Collection<StepId> references) {
        var validator = new Validator(program);
        validator.checkDeclarations();
        validator.checkSteps();
        validator.checkReferences(references);
        return List.copyOf(validator.errors);
    }

    private void checkDeclarations() {
        var owners = new HashMap<String, DeclarationSection>();
        for (DeclarationSection section : DeclarationSection.values()) {
            for (Declaration declaration : program.declarations(section)) {
                var owner = owners.putIfAbsent(declaration.name(), section);
                if (owner != null) {
                    errors.add(StaticError.global(
                        StaticErrorKind.DUPLICATE_DECLARATION,
                        "'" + declaration.name() + "' in " + section + " is already declared in " + owner
                    ));
                    continue;
                }
                symbols.put(declaration.name(), declaration.type());
            }
        }
        for (Declaration declaration : program.state()) {
            declaration.initializer().ifPresent(init -> {
                if (!declaration.type().compatibleWith(init.type())) {
                    errors.add(StaticError.global(
                        StaticErrorKind.TYPE_MISMATCH,
                        "initializer of '" + declaration.name() + "' is " + init.type().keyword()
                            + " but the declared type is " + declaration.type().keyword()
                    ));
                }
            });
        }
        var inputs = new HashSet<String>();
        program.io().inputs().forEach(input -> inputs.add(input.name()));
        for (String param : program.func().params()) {
            if (!inputs.contains(param)) {
                errors.add(StaticError.global(
                    StaticErrorKind.UNKNOWN_PARAMETER,
                    "parameter '" + param + "' is not declared in INPUT"
                ));
            }
        }
    }

    private void checkSteps() {
        var seen = new HashSet<StepId>();
        StepTree.walk(program.steps(), step -> {
            if (!seen.add(step.id())) {
                sink.report(StaticErrorKind.DUPLICATE_STEP_ID, step.id(), "step ID " + step.id() + " is used more than once");
            }
            step.accept(new StepChecker(step.id()));
        });
    }

    private void checkReferences(Collection<StepId> references) {
        for (StepId reference : references) {
            if (program.findStep(reference).isEmpty()) {
                sink.report(StaticErrorKind.UNRESOLVED_STEP_REF, reference, "step " + reference + " does not exist");
            }
        }
    }

    private final class StepChecker implements StepVisitor<Void> {
        private final StepId stepId;
        private final TypeChecker types;

        StepChecker(StepId stepId) {
            this.stepId = stepId;
            this.types = new TypeChecker(symbols, stepId, sink);
        }

        @Override
        public Void visitSeq(Step.Seq step) {
            return null;
        }

        @Override
        public Void visitAssign(Step.Assign step) {
            var target = declared(step.target());
            var value = types.infer(step.expr());
            if (target != null && !target.compatibleWith(value)) {
                sink.report(
                    StaticErrorKind.TYPE_MISMATCH,
                    stepId,
                    "cannot assign " + value.keyword() + " to '" + step.target() + "' of type " + target.keyword()
                );
            }
            return null;
        }

        @Override
        public Void visitIf(Step.If step) {
            expect(step.cond(), ValueType.BOOL, "IF condition");
            return null;
        }

        @Override
        public Void visitLoop(Step.Loop step) {
            var iter = declared(step.iter());
            if (iter != null && !iter.compatibleWith(ValueType.INT)) {
                sink.report(
                    StaticErrorKind.TYPE_MISMATCH,
                    stepId,
                    "loop variable '" + step.iter() + "' must be int but is " + iter.keyword()
                );
            }
            expect(step.from(), ValueType.INT, "LOOP FROM");
            expect(step.to(), ValueType.INT, "LOOP TO");
            return null;
        }

        @Override
        public Void visitReturn(Step.Return step) {
            var declared = program.func().returnType();
            var actual = types.infer(step.expr());
            if (!declared.compatibleWith(actual)) {
                sink.report(
                    StaticErrorKind.RETURN_TYPE_MISMATCH,
                    stepId,
                    "returns " + actual.keyword() + " but the function declares " + declared.keyword()
                );
            }
            return null;
        }

        private ValueType declared(String name) {
            var type = symbols.get(name);
            if (type == null) {
                sink.report(StaticErrorKind.UNDECLARED_VARIABLE, stepId, "variable '" + name + "' is not declared");
            }
            return type;
        }

        private void expect(Expr expr, ValueType expected, String what) {
            var actual = types.infer(expr);
            if (!actual.compatibleWith(expected)) {
                sink.report(StaticErrorKind.TYPE_MISMATCH, stepId, what + " must be " + expected.keyword() + " but is " + actual.keyword());
            }
        }
    }
}
