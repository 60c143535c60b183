package work.isu.core.api;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import work.isu.core.canon.Canonicalizer;
import work.isu.core.diag.IsuStaticException;
import work.isu.core.diag.StaticError;
import work.isu.core.model.Program;
import work.isu.core.model.StepId;
import work.isu.core.parse.IsuParser;
import work.isu.core.parse.RawProgram;
import work.isu.core.patch.PatchApplier;
import work.isu.core.patch.PatchOutcome;
import work.isu.core.pretty.PrettyPrinter;
import work.isu.core.runtime.ExecutionContext;
import work.isu.core.runtime.ExecutionResult;
import work.isu.core.runtime.Interpreter;
import work.isu.core.validate.Validator;

/**
 * Facade over parse, canonicalize, validate, interpret, patch and print. With caching on,
 * canonical programs are memoised by exact source text; cached values are immutable. The cache
 * holds at most {@code cacheLimit} programs; once full, further texts are canonicalized without
 * being stored.
 */
public final class IsuPipeline {
    public static final int DEFAULT_CACHE_LIMIT = 512;

    private final boolean cacheEnabled;
    private final int cacheLimit;
    private final IsuLog log;
    private final Map<String, Program> cache = new ConcurrentHashMap<>();

    public IsuPipeline() {
        this(false, IsuLog.silent());
    }

    public IsuPipeline(boolean cacheEnabled, IsuLog log) {
        this(cacheEnabled, DEFAULT_CACHE_LIMIT, log);
    }

    public IsuPipeline(boolean cacheEnabled, int cacheLimit, IsuLog log) {
        if (cacheLimit < 0) {
            throw new IllegalArgumentException("cacheLimit must be >= 0");
        }
        this.cacheEnabled = cacheEnabled;
        this.cacheLimit = cacheLimit;
        this.log = Objects.requireNonNull(log, "log");
    }

    public RawProgram parse(String text) {
        return IsuParser.parse(text);
    }

    /** Parses and canonicalizes without validating. */
    public Program canonicalize(String text) {
        if (!cacheEnabled) {
            return canonicalizeUncached(text);
        }
        var cached = cache.get(text);
        if (cached != null) {
            log.debug("canonical cache hit (%d chars)", text.length());
            return cached;
        }
        var program = canonicalizeUncached(text);
        if (cache.size() >= cacheLimit) {
            log.debug("canonical cache full (%d programs); not storing", cacheLimit);
            return program;
        }
        var existing = cache.putIfAbsent(text, program);
        return existing != null ? existing : program;
    }

    public List<StaticError> check(String text) {
        return Validator.validate(canonicalize(text));
    }

    /**
     * Canonicalizes and validates.
     *
     * @throws IsuStaticException carrying every validation error
     */
    public Program load(String text) {
        var program = canonicalize(text);
        var errors = Validator.validate(program);
        if (!errors.isEmpty()) {
            log.info("program '%s' has %d static error(s)", program.func().name(), errors.size());
            throw new IsuStaticException(errors);
        }
        return program;
    }

    public ExecutionResult run(String text, Map<String, ?> inputs, ExecutionContext ctx) {
        var program = load(text);
        log.debug("interpreting '%s'", program.func().name());
        return Interpreter.interpret(program, inputs, ctx);
    }

    public PatchOutcome patch(Program program, String patchText) {
        var outcome = PatchApplier.applyCommand(program, patchText);
        log.debug("patched '%s'", program.func().name());
        return outcome;
    }

    public PatchOutcome patch(Program program, StepId target, String fragmentText) {
        return PatchApplier.apply(program, target, fragmentText);
    }

    public String print(Program program) {
        return PrettyPrinter.print(program);
    }

    public int cachedPrograms() {
        return cache.size();
    }

    private Program canonicalizeUncached(String text) {
        return Canonicalizer.canonicalize(IsuParser.parse(text));
    }
}
