package work.isu.core.fixtures;

import java.util.List;

public record FixtureResult(String name, List<TestFail> failures) {
    public FixtureResult {
        failures = List.copyOf(failures);
    }

    public boolean passed() {
        return failures.isEmpty();
    }
}
