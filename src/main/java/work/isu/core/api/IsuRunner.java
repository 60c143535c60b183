package work.isu.core.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import work.isu.core.diag.IsuParseException;
import work.isu.core.diag.IsuRuntimeException;
import work.isu.core.diag.IsuStaticException;
import work.isu.core.json.ValueJson;
import work.isu.core.runtime.ExecutionContext;
import work.isu.core.runtime.FunctionRegistry;
import work.isu.core.runtime.Interpreter;

/**
 * Public entry point for embedding the pipeline: load a program file, bind inputs, run.
 */
public final class IsuRunner {
    private final IsuPipeline pipeline;

    public IsuRunner() {
        this(null);
    }

    /** Reuses {@code pipeline} (and its cache) across runs; {@code null} builds one per run. */
    public IsuRunner(IsuPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public RunResult run(IsuRunConfiguration configuration) {
        var started = Instant.now();
        var log = new IsuLog(configuration.logLevel());
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("program", configuration.source().toString());
        metadata.put("logLevel", configuration.logLevel().name());
        try {
            var text = Files.readString(configuration.source(), StandardCharsets.UTF_8);
            var active = pipeline != null ? pipeline : new IsuPipeline(configuration.cache(), log);
            var program = active.load(text);
            var inputs = ValueJson.readBindings(configuration.inputPayload());
            var ctx = new ExecutionContext(
                FunctionRegistry.standard(),
                new ExecutionContext.CancellationToken(),
                configuration.timeout().orElse(null),
                configuration.maxIterations()
            );
            var result = Interpreter.interpret(program, inputs, ctx);
            metadata.put("function", program.func().name());
            metadata.put("result", result.toMap());
            metadata.put("iterations", ctx.iterations());
            metadata.put("status", "ok");
            log.info("%s finished after %d loop iteration(s)", program.func().name(), ctx.iterations());
            return RunResult.success(metadata, started);
        } catch (IsuParseException | IsuStaticException ex) {
            log.error("%s", ex.getMessage());
            debug(ex);
            return RunResult.rejected(ex.toMap(), metadata, started);
        } catch (IsuRuntimeException ex) {
            log.error("%s", ex.getMessage());
            debug(ex);
            return RunResult.failure(ex.toMap(), metadata, started);
        } catch (IOException | IllegalArgumentException ex) {
            log.error("%s", ex.getMessage());
            debug(ex);
            return RunResult.failure(plainError(ex), metadata, started);
        }
    }

    private static Map<String, Object> plainError(Exception ex) {
        var error = new LinkedHashMap<String, Object>();
        error.put("code", ex instanceof IOException ? "io_error" : "invalid_input");
        error.put("message", ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        return error;
    }

    private static void debug(Exception ex) {
        if (Boolean.getBoolean("isu.debug")) {
            ex.printStackTrace();
        }
    }
}
