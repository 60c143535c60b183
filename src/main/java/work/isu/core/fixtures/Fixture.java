package work.isu.core.fixtures;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One expected-output case: a program, its inputs, and what running it must produce.
 *
 * @param expectedReturn value the program must {@code RETURN}, when given
 * @param expectedOutputs {@code OUTPUT} bindings that must match, possibly a subset
 * @param expectedError error code the run must fail with ({@code parse_error}, {@code static_error}
 *     or a runtime fault code such as {@code division_by_zero})
 * @param expectedStep step ID the runtime fault must name, when given
 */
public record Fixture(
    String name,
    Path source,
    Path program,
    Map<String, Object> inputs,
    Optional<Object> expectedReturn,
    Map<String, Object> expectedOutputs,
    Optional<String> expectedError,
    Optional<String> expectedStep
) {
    public Fixture {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(program, "program");
        inputs = Map.copyOf(inputs);
        expectedOutputs = Map.copyOf(expectedOutputs);
    }
}
