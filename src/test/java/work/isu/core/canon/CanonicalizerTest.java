package work.isu.core.canon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.isu.core.diag.IsuParseException;
import work.isu.core.diag.IsuStaticException;
import work.isu.core.diag.StaticErrorKind;
import work.isu.core.model.Expr;
import work.isu.core.model.Step;
import work.isu.core.model.StepId;
import work.isu.core.model.StepTree;
import work.isu.core.model.ValueType;
import work.isu.core.parse.IsuParser;
import work.isu.core.parse.RawProgram;
import work.isu.core.support.IsuTestSupport;

class CanonicalizerTest {
    @Test
    void canonicalizingCanonicalFormIsIdentity() {
        for (String name : List.of("assign_return.isu", "bounds_check.isu", "sum_to.isu", "words.isu")) {
            var once = IsuTestSupport.program(name);
            var twice = Canonicalizer.canonicalize(RawProgram.of(once));
            assertEquals(once, twice, name);
        }
    }

    @Test
    void autoIdNumbersByPosition() {
        var program = IsuTestSupport.program("sum_to.isu");
        assertEquals(
            List.of("S1", "S1_1", "S1_2", "S1_2_1", "S2"),
            ids(program.steps())
        );
    }

    @Test
    void elseBranchContinuesTheThenCounter() {
        var program = IsuTestSupport.program("bounds_check.isu");
        var ifStep = (Step.If) program.steps().body().get(0);
        assertEquals(StepId.parse("S1_1"), ifStep.thenBranch().get(0).id());
        assertEquals(StepId.parse("S1_2"), ifStep.elseBranch().get(0).id());
        assertEquals(StepId.parse("S2"), program.steps().body().get(1).id());
    }

    @Test
    void siblingLoopBodiesRestartNumbering() {
        var text = IsuTestSupport.autoIdProgram("int", "[]", "  - i: int\n  - j: int", String.join("\n",
            "    LOOP",
            "      ITER: i",
            "      FROM: 0",
            "      TO: 2",
            "      BODY: BEGIN",
            "        ASSIGN",
            "          TARGET: j",
            "          EXPR: (var i)",
            "      END",
            "    LOOP",
            "      ITER: j",
            "      FROM: 0",
            "      TO: 2",
            "      BODY: BEGIN",
            "        ASSIGN",
            "          TARGET: i",
            "          EXPR: (var j)",
            "      END",
            "    RETURN",
            "      EXPR: (var i)"
        ));
        var program = IsuTestSupport.canonical(text);
        assertEquals(List.of("S1", "S1_1", "S2", "S2_1", "S3"), ids(program.steps()));
    }

    @Test
    void idsAreStableWhenUnrelatedLaterStepsChange() {
        var base = IsuTestSupport.source("sum_to.isu");
        var edited = base.replace("EXPR: (var total)", "EXPR: (add (var total) (const 0))");
        var before = IsuTestSupport.canonical(base);
        var after = IsuTestSupport.canonical(edited);
        assertEquals(ids(before.steps()), ids(after.steps()));
        assertEquals(before.steps().body().get(0), after.steps().body().get(0));
    }

    @Test
    void explicitIdsMustMatchPositionUnderAutoId() {
        var text = IsuTestSupport.autoIdProgram("int", "[]", "", String.join("\n",
            "    S1: RETURN",
            "      EXPR: (const 1)",
            "    S5: RETURN",
            "      EXPR: (const 2)"
        ));
        var ex = assertThrows(IsuStaticException.class, () -> IsuTestSupport.canonical(text));
        assertEquals(StaticErrorKind.STEP_ID_MISMATCH, ex.first().kind());
        assertEquals(Optional.of(StepId.parse("S5")), ex.first().stepId());
    }

    @Test
    void duplicateExplicitIdsAreRejected() {
        var text = String.join("\n",
            "FUNC:",
            "  NAME: dup",
            "IO:",
            "  INPUT: []",
            "STATE: []",
            "LOCAL: []",
            "STEPS:",
            "  SEQ: BEGIN",
            "    S1: RETURN",
            "      EXPR: (const 1)",
            "    S1: RETURN",
            "      EXPR: (const 2)",
            "  END"
        );
        var ex = assertThrows(IsuStaticException.class, () -> IsuTestSupport.canonical(text));
        assertEquals(StaticErrorKind.DUPLICATE_STEP_ID, ex.first().kind());
    }

    @Test
    void explicitIdsAreKeptWithoutAutoId() {
        var text = String.join("\n",
            "FUNC:",
            "  NAME: kept",
            "IO:",
            "  INPUT: []",
            "STATE: []",
            "LOCAL: []",
            "STEPS:",
            "  SEQ: BEGIN",
            "    S7: RETURN",
            "      EXPR: (const 1)",
            "  END"
        );
        var program = IsuTestSupport.canonical(text);
        assertEquals(StepId.parse("S7"), program.steps().body().get(0).id());
    }

    @Test
    void braceShorthandDisappearsInCanonicalForm() {
        var braces = IsuTestSupport.source("bounds_check.isu");
        var beginEnd = braces
            .replace("THEN: {", "THEN: BEGIN")
            .replace("ELSE: {", "ELSE: BEGIN")
            .replace("      }", "      END");
        assertEquals(IsuTestSupport.canonical(beginEnd), IsuTestSupport.canonical(braces));
    }

    @Test
    void fillsFuncDefaults() {
        var program = IsuTestSupport.program("bounds_check.isu");
        assertEquals(List.of("xs", "i"), program.func().params());
        assertEquals(ValueType.STRING, program.func().returnType());

        var noReturns = IsuTestSupport.canonical(IsuTestSupport.source("assign_return.isu").replace("  RETURNS: int\n", ""));
        assertEquals(ValueType.ANY, noReturns.func().returnType());
    }

    @Test
    void keepsMetaFlagsAndStateInitializers() {
        var program = IsuTestSupport.program("sum_to.isu");
        assertTrue(program.autoId());
        assertEquals("tests", program.meta().orElseThrow().flags().get("OWNER"));
        assertEquals(Optional.of(Expr.Const.ofInt(0)), program.state().get(0).initializer());
    }

    @Test
    void missingRequiredFieldIsAParseError() {
        var text = IsuTestSupport.autoIdProgram("int", "[]", "  - x: int", String.join("\n",
            "    IF",
            "      COND: true",
            "      THEN: {}",
            "    RETURN",
            "      EXPR: (var x)"
        ));
        var ex = assertThrows(IsuParseException.class, () -> IsuTestSupport.canonical(text));
        assertTrue(ex.reason().contains("missing required field ELSE"));
    }

    @Test
    void fieldsOfAnotherKindAreRejected() {
        var text = IsuTestSupport.autoIdProgram("int", "[]", "  - x: int", String.join("\n",
            "    ASSIGN",
            "      TARGET: x",
            "      EXPR: (const 1)",
            "      COND: true"
        ));
        var ex = assertThrows(IsuParseException.class, () -> IsuTestSupport.canonical(text));
        assertTrue(ex.reason().contains("not allowed in ASSIGN"));
    }

    @Test
    void duplicateFieldsAreRejected() {
        var text = IsuTestSupport.autoIdProgram("int", "[]", "", String.join("\n",
            "    RETURN",
            "      EXPR: (const 1)",
            "      EXPR: (const 2)"
        ));
        var ex = assertThrows(IsuParseException.class, () -> IsuTestSupport.canonical(text));
        assertTrue(ex.reason().contains("duplicate field EXPR"));
    }

    @Test
    void unknownTypesAndKeysAreParseErrors() {
        var badType = IsuTestSupport.autoIdProgram("float", "[]", "", "    RETURN\n      EXPR: (const 1)");
        assertThrows(IsuParseException.class, () -> IsuTestSupport.canonical(badType));

        var badKey = IsuTestSupport.source("assign_return.isu").replace("  PARAMS: []", "  ARGS: []");
        var ex = assertThrows(IsuParseException.class, () -> IsuTestSupport.canonical(badKey));
        assertTrue(ex.reason().contains("unknown FUNC key"));
    }

    @Test
    void localInitializersAreRejected() {
        var text = IsuTestSupport.autoIdProgram("int", "[]", "  - x: int = 3", "    RETURN\n      EXPR: (var x)");
        var ex = assertThrows(IsuParseException.class, () -> IsuTestSupport.canonical(text));
        assertTrue(ex.reason().contains("cannot have initializers"));
    }

    @Test
    void fragmentRootTakesTheTargetId() {
        var raw = IsuParser.parseFragment(String.join("\n",
            "IF",
            "  COND: true",
            "  THEN: {",
            "    RETURN",
            "      EXPR: (const 1)",
            "  }",
            "  ELSE: {}"
        ));
        var step = (Step.If) Canonicalizer.canonicalizeFragment(raw, StepId.parse("S3_2"));
        assertEquals(StepId.parse("S3_2"), step.id());
        assertEquals(StepId.parse("S3_2_1"), step.thenBranch().get(0).id());
        assertTrue(step.elseBranch().isEmpty());
    }

    private static List<String> ids(Step root) {
        var ids = new ArrayList<String>();
        StepTree.walk(root, step -> ids.add(step.id().toString()));
        return ids;
    }
}
