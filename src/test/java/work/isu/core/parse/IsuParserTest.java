package work.isu.core.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.isu.core.diag.IsuParseException;
import work.isu.core.model.StepId;
import work.isu.core.model.StepKind;
import work.isu.core.support.IsuTestSupport;

class IsuParserTest {
    private static final String HEAD = String.join("\n",
        "FUNC:",
        "  NAME: f",
        "IO:",
        "  INPUT: []",
        "STATE: []",
        "LOCAL: []",
        "STEPS:",
        ""
    );

    @Test
    void readsSectionsAndSteps() {
        var raw = IsuParser.parse(IsuTestSupport.source("assign_return.isu"));
        assertTrue(raw.meta().isEmpty());
        assertEquals("first", raw.func().items().get(0).value());
        assertEquals(1, raw.local().items().size());
        assertEquals(StepKind.SEQ, raw.steps().kind());
        var body = (RawValue.Block) raw.steps().fields().get(0).value();
        assertEquals(2, body.steps().size());
        assertEquals(Optional.of(StepId.parse("S1")), body.steps().get(0).id());
        assertEquals(StepKind.RETURN, body.steps().get(1).kind());
    }

    @Test
    void keywordsAreCaseInsensitiveAndCommentsIgnored() {
        var text = HEAD
            + "  ; root block\n"
            + "  seq: begin\n"
            + "    S1: return\n"
            + "      expr: (const 1)\n"
            + "  end\n";
        var raw = IsuParser.parse(text);
        var body = (RawValue.Block) raw.steps().fields().get(0).value();
        assertEquals(StepKind.RETURN, body.steps().get(0).kind());
    }

    @Test
    void blockOpenerMayStandOnItsOwnLine() {
        var text = HEAD
            + "  SEQ: BEGIN\n"
            + "    S1: IF\n"
            + "      COND: true\n"
            + "      THEN:\n"
            + "      BEGIN\n"
            + "        S1_1: RETURN\n"
            + "          EXPR: (const 1)\n"
            + "      END\n"
            + "      ELSE: {}\n"
            + "  END\n";
        var raw = IsuParser.parse(text);
        var body = (RawValue.Block) raw.steps().fields().get(0).value();
        var then = (RawValue.Block) body.steps().get(0).fields().get(1).value();
        assertEquals(BlockStyle.BEGIN_END, then.style());
        assertEquals(1, then.steps().size());
        var otherwise = (RawValue.Block) body.steps().get(0).fields().get(2).value();
        assertEquals(BlockStyle.BRACES, otherwise.style());
        assertTrue(otherwise.steps().isEmpty());

        var rootOnNextLine = HEAD
            + "  SEQ:\n"
            + "  BEGIN\n"
            + "    S1: RETURN\n"
            + "      EXPR: (const 1)\n"
            + "  END\n";
        var root = IsuParser.parse(rootOnNextLine).steps();
        assertEquals(1, root.fields().size());
        var rootBody = (RawValue.Block) root.fields().get(0).value();
        assertEquals(BlockStyle.BEGIN_END, rootBody.style());
        assertEquals(1, rootBody.steps().size());
    }

    @Test
    void bracesAreAcceptedAsBlockShorthand() {
        var raw = IsuParser.parse(IsuTestSupport.source("bounds_check.isu"));
        var body = (RawValue.Block) raw.steps().fields().get(0).value();
        var ifStep = body.steps().get(0);
        assertTrue(ifStep.id().isEmpty());
        var then = (RawValue.Block) ifStep.fields().get(1).value();
        assertEquals(BlockStyle.BRACES, then.style());
        assertEquals(1, then.steps().size());
    }

    @Test
    void requiresStepIdsWithoutAutoId() {
        var text = HEAD
            + "  SEQ: BEGIN\n"
            + "    RETURN\n"
            + "      EXPR: (const 1)\n"
            + "  END\n";
        var ex = assertThrows(IsuParseException.class, () -> IsuParser.parse(text));
        assertEquals(9, ex.line());
        assertTrue(ex.reason().contains("step ID required"));
    }

    @Test
    void rejectsSectionsOutOfOrder() {
        var text = "IO:\n  INPUT: []\nFUNC:\n  NAME: f\n";
        var ex = assertThrows(IsuParseException.class, () -> IsuParser.parse(text));
        assertEquals(1, ex.line());
        assertTrue(ex.reason().contains("expected FUNC"));
    }

    @Test
    void rejectsMismatchedBlockCloser() {
        var text = HEAD
            + "  SEQ: BEGIN\n"
            + "    S1: RETURN\n"
            + "      EXPR: (const 1)\n"
            + "  }\n";
        var ex = assertThrows(IsuParseException.class, () -> IsuParser.parse(text));
        assertEquals(11, ex.line());
        assertTrue(ex.reason().contains("closed by '}'"));
    }

    @Test
    void reportsUnclosedBlockAtItsOpener() {
        var text = HEAD
            + "  SEQ: BEGIN\n"
            + "    S1: RETURN\n"
            + "      EXPR: (const 1)\n";
        var ex = assertThrows(IsuParseException.class, () -> IsuParser.parse(text));
        assertEquals(8, ex.line());
        assertTrue(ex.reason().contains("never closed"));
    }

    @Test
    void reportsUnknownStepKindsAndStrayFields() {
        var unknown = HEAD + "  SEQ: BEGIN\n    S1: PRINT\n  END\n";
        var ex = assertThrows(IsuParseException.class, () -> IsuParser.parse(unknown));
        assertTrue(ex.reason().contains("unknown step kind 'PRINT'"));

        var stray = HEAD + "  SEQ: BEGIN\n    TARGET\n  END\n";
        var strayEx = assertThrows(IsuParseException.class, () -> IsuParser.parse(stray));
        assertTrue(strayEx.reason().contains("outside of a step"));
    }

    @Test
    void rejectsMalformedStepIds() {
        var text = HEAD + "  SEQ: BEGIN\n    S1_0: RETURN\n      EXPR: (const 1)\n  END\n";
        var ex = assertThrows(IsuParseException.class, () -> IsuParser.parse(text));
        assertTrue(ex.reason().contains("malformed step ID"));
    }

    @Test
    void rejectsContentAfterRootBlock() {
        var text = HEAD + "  SEQ: BEGIN\n  END\n  SEQ: BEGIN\n  END\n";
        var ex = assertThrows(IsuParseException.class, () -> IsuParser.parse(text));
        assertEquals(10, ex.line());
    }

    @Test
    void rejectsEmptyInput() {
        var ex = assertThrows(IsuParseException.class, () -> IsuParser.parse("; nothing here\n\n"));
        assertEquals(1, ex.line());
    }

    @Test
    void parsesStateInitializers() {
        var raw = IsuParser.parse(IsuTestSupport.source("sum_to.isu"));
        var total = raw.state().items().get(0);
        assertEquals("total", total.name());
        assertEquals("int", total.type());
        assertEquals(Optional.of("0"), total.initializer());
    }

    @Test
    void parsesPatchDirective() {
        var directive = IsuParser.parsePatch(String.join("\n",
            "PATCH:",
            "  REPLACE S2_1:",
            "    ASSIGN",
            "      TARGET: x",
            "      EXPR: (const 2)"
        ));
        assertEquals(StepId.parse("S2_1"), directive.target());
        assertEquals(StepKind.ASSIGN, directive.replacement().kind());
    }

    @Test
    void patchAcceptsExactlyOneReplacement() {
        var twoSteps = String.join("\n",
            "PATCH:",
            "  REPLACE S1:",
            "    RETURN",
            "      EXPR: (const 1)",
            "    RETURN",
            "      EXPR: (const 2)"
        );
        var ex = assertThrows(IsuParseException.class, () -> IsuParser.parsePatch(twoSteps));
        assertEquals(5, ex.line());

        var badTarget = "PATCH:\n  REPLACE S1_x:\n    RETURN\n      EXPR: (const 1)\n";
        assertThrows(IsuParseException.class, () -> IsuParser.parsePatch(badTarget));
    }
}
