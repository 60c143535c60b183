package work.isu.core.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.isu.core.support.IsuTestSupport;

class MainTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmd = Main.newCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void canonPrintsBeginEndBlocks() {
        int code = execute("canon", IsuTestSupport.programPath("bounds_check.isu").toString());
        assertEquals(0, code);
        assertTrue(out.toString().contains("THEN: BEGIN"), out.toString());
        assertTrue(out.toString().contains("S1_2: ASSIGN"), out.toString());
    }

    @Test
    void canonJsonIsKeyOrdered() {
        int code = execute("canon", "--json", IsuTestSupport.programPath("assign_return.isu").toString());
        assertEquals(0, code);
        assertTrue(out.toString().trim().startsWith("{"));
        assertTrue(out.toString().contains("\"tag\" : \"const\""), out.toString());
    }

    @Test
    void checkExitsWithRejectedCode() {
        int code = execute("check", IsuTestSupport.programPath("duplicate_declaration.isu").toString());
        assertEquals(2, code);
        assertTrue(out.toString().contains("duplicate_declaration"), out.toString());

        int ok = execute("check", IsuTestSupport.programPath("words.isu").toString());
        assertEquals(0, ok);
    }

    @Test
    void runPrintsResultJson() {
        int code = execute(
            "run",
            IsuTestSupport.programPath("sum_to.isu").toString(),
            "--input", "{\"n\": 4}",
            "--log-level", "fatal"
        );
        assertEquals(0, code);
        assertTrue(out.toString().contains("\"status\" : \"success\""), out.toString());
        assertTrue(out.toString().contains("\"return\" : 6"), out.toString());
    }

    @Test
    void runtimeFaultExitsWithOne() {
        int code = execute("run", IsuTestSupport.programPath("divide_by_zero.isu").toString(), "--log-level", "fatal");
        assertEquals(1, code);
        assertTrue(out.toString().contains("division_by_zero"));
    }

    @Test
    void parseErrorIsRejected(@TempDir Path dir) throws Exception {
        var broken = dir.resolve("broken.isu");
        Files.writeString(broken, "FUNC:\n  NAME: f\nSTEPS:\n", StandardCharsets.UTF_8);
        int code = execute("canon", broken.toString());
        assertEquals(2, code);
        assertTrue(err.toString().contains("3:1"), err.toString());
    }

    @Test
    void patchWritesPatchedProgram(@TempDir Path dir) throws Exception {
        var patch = dir.resolve("fix.patch");
        Files.writeString(patch, "PATCH:\n  REPLACE S2:\n    RETURN\n      EXPR: (add (var x) 1)\n", StandardCharsets.UTF_8);
        var target = dir.resolve("patched.isu");
        int code = execute("patch", IsuTestSupport.programPath("assign_return.isu").toString(), patch.toString(), "-o", target.toString());
        assertEquals(0, code);
        assertTrue(Files.readString(target).contains("EXPR: (add (var x) (const 1))"));
    }

    @Test
    void patchOnUnknownStepIsRejected(@TempDir Path dir) throws Exception {
        var patch = dir.resolve("fix.patch");
        Files.writeString(patch, "PATCH:\n  REPLACE S9_9:\n    RETURN\n      EXPR: 1\n", StandardCharsets.UTF_8);
        int code = execute("patch", IsuTestSupport.programPath("assign_return.isu").toString(), patch.toString());
        assertEquals(2, code);
        assertTrue(err.toString().contains("unresolved_step_ref@S9_9"), err.toString());
    }

    @Test
    void testCommandRunsFixtures() {
        int code = execute("test", IsuTestSupport.resources().resolve("fixtures").toString());
        assertEquals(0, code);
        assertTrue(out.toString().contains("5/5 fixtures passed"), out.toString());
    }
}
