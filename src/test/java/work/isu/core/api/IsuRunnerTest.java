package work.isu.core.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.isu.core.support.IsuTestSupport;

class IsuRunnerTest {
    @Test
    @SuppressWarnings("unchecked")
    void runsProgramFileWithJsonInputs() {
        var config = IsuRunConfiguration.builder()
            .source(IsuTestSupport.programPath("bounds_check.isu"))
            .inputPayload("{\"xs\": [], \"i\": 0}")
            .logLevel(LogLevel.FATAL)
            .build();

        var result = new IsuRunner().run(config);
        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals("bounds_check", result.metadata().get("function"));
        var outcome = (Map<String, Object>) result.metadata().get("result");
        assertEquals("else", outcome.get("return"));
        assertEquals(Map.of("branch", "else"), outcome.get("outputs"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void runtimeFaultIsAFailure() {
        var config = IsuRunConfiguration.builder()
            .source(IsuTestSupport.programPath("divide_by_zero.isu"))
            .logLevel(LogLevel.FATAL)
            .build();

        var result = new IsuRunner().run(config);
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        var error = (Map<String, Object>) result.metadata().get("error");
        assertEquals("division_by_zero", error.get("code"));
        assertEquals("S2", error.get("step"));
        assertEquals("div", error.get("operator"));
    }

    @Test
    void staticErrorsRejectTheProgram() {
        var config = IsuRunConfiguration.builder()
            .source(IsuTestSupport.programPath("duplicate_declaration.isu"))
            .inputPayload("{\"n\": 1}")
            .logLevel(LogLevel.FATAL)
            .build();

        var result = new IsuRunner().run(config);
        assertEquals(RunResult.Status.REJECTED, result.status());
        assertEquals(2, result.status().exitCode());
        assertTrue(result.toPrettyJson().contains("duplicate_declaration"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void badInputsAndMissingFilesAreFailures() {
        var badInput = IsuRunConfiguration.builder()
            .source(IsuTestSupport.programPath("sum_to.isu"))
            .inputPayload("{\"n\": \"five\"}")
            .logLevel(LogLevel.FATAL)
            .build();
        var result = new IsuRunner().run(badInput);
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("invalid_input", ((Map<String, Object>) result.metadata().get("error")).get("code"));

        var missing = IsuRunConfiguration.builder()
            .source(IsuTestSupport.programPath("nope.isu"))
            .logLevel(LogLevel.FATAL)
            .build();
        var missingResult = new IsuRunner().run(missing);
        assertEquals("io_error", ((Map<String, Object>) missingResult.metadata().get("error")).get("code"));
    }

    @Test
    void iterationBudgetFromConfiguration() {
        var config = IsuRunConfiguration.builder()
            .source(IsuTestSupport.programPath("sum_to.isu"))
            .inputPayload("{\"n\": 50}")
            .maxIterations(10)
            .logLevel(LogLevel.FATAL)
            .build();

        var result = new IsuRunner().run(config);
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertTrue(result.toPrettyJson().contains("\"cancelled\""));
    }
}
