package work.isu.core.fixtures;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import work.isu.core.api.IsuPipeline;
import work.isu.core.diag.IsuException;
import work.isu.core.diag.IsuRuntimeException;
import work.isu.core.diag.IsuStaticException;
import work.isu.core.model.StepId;
import work.isu.core.runtime.ExecutionContext;
import work.isu.core.runtime.ExecutionResult;
import work.isu.core.runtime.Values;

/**
 * Loads {@code *.fixture.yaml} files and checks interpreter results against them:
 *
 * <pre>
 * name: sum of list
 * program: sum.isu
 * inputs: {xs: [1, 2, 3]}
 * expect:
 *   return: 6
 *   outputs: {total: 6}
 * </pre>
 *
 * or, for failures, {@code expect: {error: division_by_zero, step: S3}}. For {@code static_error}
 * the step is taken from the first reported error.
 */
public final class FixtureRunner {
    public static final String SUFFIX = ".fixture.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.USE_LONG_FOR_INTS);
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final IsuPipeline pipeline;

    public FixtureRunner(IsuPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /** Fixture files under {@code root} (a directory or one file), sorted by path. */
    public static List<Path> discover(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    public static Fixture load(Path file) throws IOException {
        Map<String, Object> raw = YAML.readValue(Files.readString(file, StandardCharsets.UTF_8), MAP_REF);
        if (raw == null || !(raw.get("program") instanceof String program)) {
            throw new IllegalArgumentException(file + ": fixture needs a 'program' path");
        }
        String name = raw.get("name") instanceof String n ? n : defaultName(file);
        Map<String, Object> inputs = values(file, raw, "inputs");
        Map<String, Object> expect = table(file, raw, "expect");
        Optional<Object> expectedReturn = expect.containsKey("return") ? Optional.of(Values.normalize(expect.get("return"))) : Optional.empty();
        Map<String, Object> expectedOutputs = values(file, expect, "outputs");
        Optional<String> error = Optional.ofNullable(expect.get("error")).map(String::valueOf);
        Optional<String> step = Optional.ofNullable(expect.get("step")).map(String::valueOf);
        Path base = file.toAbsolutePath().getParent();
        return new Fixture(name, file, base.resolve(program).normalize(), inputs, expectedReturn, expectedOutputs, error, step);
    }

    private static String defaultName(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.endsWith(SUFFIX) && fileName.length() > SUFFIX.length()
            ? fileName.substring(0, fileName.length() - SUFFIX.length())
            : fileName;
    }

    private static Map<String, Object> table(Path file, Map<String, Object> owner, String key) {
        Object value = owner.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(file + ": '" + key + "' must be a map");
        }
        var copy = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static Map<String, Object> values(Path file, Map<String, Object> owner, String key) {
        var copy = new LinkedHashMap<String, Object>();
        table(file, owner, key).forEach((name, value) -> copy.put(name, Values.normalize(value)));
        return copy;
    }

    public FixtureResult run(Fixture fixture) {
        var failures = new ArrayList<TestFail>();
        String text;
        try {
            text = Files.readString(fixture.program(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            failures.add(new TestFail(fixture.name(), "program", fixture.program().toString(), "unreadable: " + ex.getMessage()));
            return new FixtureResult(fixture.name(), failures);
        }
        ExecutionResult result;
        try {
            result = pipeline.run(text, fixture.inputs(), new ExecutionContext());
        } catch (IsuException ex) {
            checkError(fixture, ex, failures);
            return new FixtureResult(fixture.name(), failures);
        } catch (IllegalArgumentException ex) {
            failures.add(new TestFail(fixture.name(), "inputs", "valid bindings", ex.getMessage()));
            return new FixtureResult(fixture.name(), failures);
        }
        fixture.expectedError().ifPresent(code -> failures.add(new TestFail(fixture.name(), "error", code, "success")));
        fixture.expectedReturn().ifPresent(expected -> {
            Object actual = result.returnValue().orElse(null);
            if (!expected.equals(actual)) {
                failures.add(new TestFail(fixture.name(), "return", expected, actual));
            }
        });
        fixture.expectedOutputs().forEach((name, expected) -> {
            Object actual = result.outputs().get(name);
            if (!expected.equals(actual)) {
                failures.add(new TestFail(fixture.name(), "outputs." + name, expected, actual));
            }
        });
        return new FixtureResult(fixture.name(), failures);
    }

    private static void checkError(Fixture fixture, IsuException ex, List<TestFail> failures) {
        if (fixture.expectedError().isEmpty()) {
            failures.add(new TestFail(fixture.name(), "error", "success", ex.code() + ": " + ex.getMessage()));
            return;
        }
        if (!fixture.expectedError().get().equals(ex.code())) {
            failures.add(new TestFail(fixture.name(), "error", fixture.expectedError().get(), ex.code()));
        }
        fixture.expectedStep().ifPresent(step -> {
            String actual = failingStep(ex).map(StepId::toString).orElse(null);
            if (!step.equals(actual)) {
                failures.add(new TestFail(fixture.name(), "step", step, actual));
            }
        });
    }

    private static Optional<StepId> failingStep(IsuException ex) {
        if (ex instanceof IsuRuntimeException runtime) {
            return Optional.ofNullable(runtime.stepId());
        }
        if (ex instanceof IsuStaticException rejected) {
            return rejected.first().stepId();
        }
        return Optional.empty();
    }
}
