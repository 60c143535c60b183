package work.isu.core.patch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.isu.core.diag.IsuParseException;
import work.isu.core.diag.IsuStaticException;
import work.isu.core.diag.StaticErrorKind;
import work.isu.core.model.Step;
import work.isu.core.model.StepId;
import work.isu.core.pretty.PrettyPrinter;
import work.isu.core.runtime.Interpreter;
import work.isu.core.support.IsuTestSupport;

class PatchApplierTest {
    @Test
    void unknownTargetLeavesProgramUntouched() {
        var program = IsuTestSupport.program("sum_to.isu");
        var before = PrettyPrinter.print(program);
        var patch = String.join("\n",
            "PATCH:",
            "  REPLACE S9_9:",
            "    ASSIGN",
            "      TARGET: total",
            "      EXPR: (const 2)"
        );
        var ex = assertThrows(IsuStaticException.class, () -> PatchApplier.applyCommand(program, patch));
        assertEquals(StaticErrorKind.UNRESOLVED_STEP_REF, ex.first().kind());
        assertEquals(Optional.of(StepId.parse("S9_9")), ex.first().stepId());
        assertEquals(before, PrettyPrinter.print(program));
        assertEquals(IsuTestSupport.program("sum_to.isu"), program);
    }

    @Test
    void replacesOneNestedStep() {
        var program = IsuTestSupport.program("sum_to.isu");
        var outcome = PatchApplier.apply(program, StepId.parse("S1_1"), String.join("\n",
            "ASSIGN",
            "  TARGET: total",
            "  EXPR: (add (var total) (mul (var i) (const 2)))"
        ));
        var patched = outcome.program();
        var loop = (Step.Loop) patched.steps().body().get(0);
        var assign = (Step.Assign) loop.body().get(0);
        assertEquals(StepId.parse("S1_1"), assign.id());
        assertSame(
            ((Step.Loop) program.steps().body().get(0)).body().get(1),
            loop.body().get(1)
        );
        assertSame(program.steps().body().get(1), patched.steps().body().get(1));
        assertEquals(Optional.of(20L), Interpreter.interpret(patched, Map.of("n", 5)).returnValue());
        assertEquals(Optional.of(10L), Interpreter.interpret(program, Map.of("n", 5)).returnValue());
        assertEquals(PrettyPrinter.print(patched), outcome.canonicalText());
    }

    @Test
    void replacementSubtreeIsRenumberedUnderTheTarget() {
        var program = IsuTestSupport.program("bounds_check.isu");
        var outcome = PatchApplier.applyCommand(program, String.join("\n",
            "PATCH:",
            "  REPLACE S1:",
            "    IF",
            "      COND: (eq (var i) 0)",
            "      THEN: BEGIN",
            "        ASSIGN",
            "          TARGET: branch",
            "          EXPR: \"zero\"",
            "      END",
            "      ELSE: BEGIN",
            "        S1_2: ASSIGN",
            "          TARGET: branch",
            "          EXPR: \"other\"",
            "      END"
        ));
        var replaced = (Step.If) outcome.program().steps().body().get(0);
        assertEquals(StepId.parse("S1_1"), replaced.thenBranch().get(0).id());
        assertEquals(StepId.parse("S1_2"), replaced.elseBranch().get(0).id());
        var result = Interpreter.interpret(outcome.program(), Map.of("xs", List.of(), "i", 0));
        assertEquals(Optional.of("zero"), result.returnValue());
    }

    @Test
    void conflictingNestedIdIsRejected() {
        var program = IsuTestSupport.program("bounds_check.isu");
        var fragment = String.join("\n",
            "IF",
            "  COND: true",
            "  THEN: {",
            "    S4: ASSIGN",
            "      TARGET: branch",
            "      EXPR: \"x\"",
            "  }",
            "  ELSE: {}"
        );
        var ex = assertThrows(IsuStaticException.class, () -> PatchApplier.apply(program, StepId.parse("S1"), fragment));
        assertEquals(StaticErrorKind.STEP_ID_MISMATCH, ex.first().kind());
    }

    @Test
    void invalidResultIsRejectedWithAllErrors() {
        var program = IsuTestSupport.program("sum_to.isu");
        var fragment = String.join("\n",
            "ASSIGN",
            "  TARGET: undeclared",
            "  EXPR: (add (var ghost) (const \"s\"))"
        );
        var ex = assertThrows(IsuStaticException.class, () -> PatchApplier.apply(program, StepId.parse("S1_1"), fragment));
        assertTrue(ex.errors().size() >= 2);
        assertTrue(ex.errors().stream().allMatch(e -> e.stepId().equals(Optional.of(StepId.parse("S1_1")))));
        assertEquals(IsuTestSupport.program("sum_to.isu"), program);
    }

    @Test
    void unparsableFragmentIsAParseError() {
        var program = IsuTestSupport.program("assign_return.isu");
        assertThrows(IsuParseException.class, () -> PatchApplier.apply(program, StepId.parse("S1"), "ASSIGN\n  TARGET: x\n  EXPR: (add 1"));
    }

    @Test
    void patchingIsDeterministic() {
        var program = IsuTestSupport.program("assign_return.isu");
        var fragment = "RETURN\n  EXPR: (add (var x) 1)";
        var first = PatchApplier.apply(program, StepId.parse("S2"), fragment);
        var second = PatchApplier.apply(program, StepId.parse("S2"), fragment);
        assertEquals(first, second);
    }
}
