package work.isu.core.validate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.isu.core.diag.StaticError;
import work.isu.core.diag.StaticErrorKind;
import work.isu.core.model.Expr;
import work.isu.core.model.Step;
import work.isu.core.model.StepId;
import work.isu.core.support.IsuTestSupport;

class ValidatorTest {
    @Test
    void samplesAreValid() {
        for (String name : List.of("assign_return.isu", "bounds_check.isu", "sum_to.isu", "words.isu", "divide_by_zero.isu")) {
            assertEquals(List.of(), Validator.validate(IsuTestSupport.program(name)), name);
        }
    }

    @Test
    void duplicateAcrossIoAndLocalIsReportedOnceForTheLaterOccurrence() {
        var errors = Validator.validate(IsuTestSupport.program("duplicate_declaration.isu"));
        assertEquals(1, errors.size());
        var error = errors.get(0);
        assertEquals(StaticErrorKind.DUPLICATE_DECLARATION, error.kind());
        assertEquals(Optional.empty(), error.stepId());
        assertTrue(error.message().contains("in LOCAL is already declared in INPUT"), error.message());
    }

    @Test
    void everyLaterOccurrenceIsReported() {
        var text = IsuTestSupport.source("duplicate_declaration.isu")
            .replace("  OUTPUT: []", "  OUTPUT: [n: int]")
            .replace("STATE: []", "STATE:\n  - n: int");
        var errors = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(3, errors.size());
        assertTrue(errors.stream().allMatch(e -> e.kind() == StaticErrorKind.DUPLICATE_DECLARATION));
    }

    @Test
    void reportsUndeclaredVariablesWithTheirStep() {
        var text = IsuTestSupport.autoIdProgram("int", "[]", "  - x: int", String.join("\n",
            "    ASSIGN",
            "      TARGET: x",
            "      EXPR: (add (var x) (var missing))",
            "    ASSIGN",
            "      TARGET: nowhere",
            "      EXPR: (const 1)",
            "    RETURN",
            "      EXPR: (var x)"
        ));
        var errors = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(2, errors.size());
        assertEquals(StaticError.at(StaticErrorKind.UNDECLARED_VARIABLE, StepId.parse("S1"), "variable 'missing' is not declared"), errors.get(0));
        assertEquals(StaticErrorKind.UNDECLARED_VARIABLE, errors.get(1).kind());
        assertEquals(Optional.of(StepId.parse("S2")), errors.get(1).stepId());
    }

    @Test
    void checksOperatorOperandTypes() {
        var text = IsuTestSupport.autoIdProgram("any", "[s: string, b: bool]", "  - x: int", String.join("\n",
            "    ASSIGN",
            "      TARGET: x",
            "      EXPR: (mul (var s) (const 2))",
            "    IF",
            "      COND: (lt (var b) (var b))",
            "      THEN: {}",
            "      ELSE: {}"
        ));
        var errors = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(2, errors.size());
        assertEquals(StaticErrorKind.TYPE_MISMATCH, errors.get(0).kind());
        assertEquals(Optional.of(StepId.parse("S1")), errors.get(0).stepId());
        assertEquals(Optional.of(StepId.parse("S2")), errors.get(1).stepId());
    }

    @Test
    void conditionsMustBeBoolean() {
        var text = IsuTestSupport.autoIdProgram("any", "[n: int]", "", String.join("\n",
            "    IF",
            "      COND: (var n)",
            "      THEN: {}",
            "      ELSE: {}"
        ));
        var errors = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).message().contains("IF condition must be bool"));
    }

    @Test
    void checksStandardFunctionArityAndKinds() {
        var text = IsuTestSupport.autoIdProgram("any", "[xs: list]", "  - n: int", String.join("\n",
            "    ASSIGN",
            "      TARGET: n",
            "      EXPR: (call LEN (var xs) (var xs))",
            "    ASSIGN",
            "      TARGET: n",
            "      EXPR: (call ABS \"seven\")",
            "    ASSIGN",
            "      TARGET: n",
            "      EXPR: (call MIN 3 1 2)"
        ));
        var errors = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(2, errors.size());
        assertEquals(StaticErrorKind.ARITY_MISMATCH, errors.get(0).kind());
        assertEquals(StaticErrorKind.TYPE_MISMATCH, errors.get(1).kind());
        assertEquals(Optional.of(StepId.parse("S2")), errors.get(1).stepId());
    }

    @Test
    void returnMustMatchDeclaredType() {
        var text = IsuTestSupport.autoIdProgram("int", "[]", "", "    RETURN\n      EXPR: (const \"no\")");
        var errors = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(1, errors.size());
        assertEquals(StaticErrorKind.RETURN_TYPE_MISMATCH, errors.get(0).kind());
    }

    @Test
    void loopVariableMustBeInt() {
        var text = IsuTestSupport.autoIdProgram("any", "[]", "  - w: string", String.join("\n",
            "    LOOP",
            "      ITER: w",
            "      FROM: 0",
            "      TO: 3",
            "      BODY: {}"
        ));
        var errors = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).message().contains("loop variable 'w'"));
    }

    @Test
    void stateInitializerMustMatchItsType() {
        var text = IsuTestSupport.source("sum_to.isu").replace("- total: int = 0", "- total: int = \"zero\"");
        var errors = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(StaticErrorKind.TYPE_MISMATCH, errors.get(0).kind());
        assertEquals(Optional.empty(), errors.get(0).stepId());
    }

    @Test
    void paramsMustNameInputs() {
        var text = IsuTestSupport.source("sum_to.isu").replace("PARAMS: [n]", "PARAMS: [n, m]");
        var errors = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(1, errors.size());
        assertEquals(StaticErrorKind.UNKNOWN_PARAMETER, errors.get(0).kind());
    }

    @Test
    void duplicateStepIdsInAHandBuiltTreeAreReported() {
        var program = IsuTestSupport.program("assign_return.isu");
        var clash = new Step.Return(StepId.parse("S1"), Expr.Const.ofInt(2));
        var broken = program.withSteps(Step.Seq.root(List.of(program.steps().body().get(0), clash)));
        var errors = Validator.validate(broken);
        assertEquals(1, errors.size());
        assertEquals(StaticErrorKind.DUPLICATE_STEP_ID, errors.get(0).kind());
    }

    @Test
    void reportsUnresolvedReferences() {
        var program = IsuTestSupport.program("assign_return.isu");
        var errors = Validator.validate(program, List.of(StepId.parse("S2"), StepId.parse("S9_9")));
        assertEquals(List.of(
            StaticError.at(StaticErrorKind.UNRESOLVED_STEP_REF, StepId.parse("S9_9"), "step S9_9 does not exist")
        ), errors);
    }

    @Test
    void validationIsDeterministic() {
        var text = IsuTestSupport.source("duplicate_declaration.isu").replace("(var n)", "(var ghost)");
        var first = Validator.validate(IsuTestSupport.canonical(text));
        var second = Validator.validate(IsuTestSupport.canonical(text));
        assertEquals(first, second);
        assertEquals(2, first.size());
    }
}
