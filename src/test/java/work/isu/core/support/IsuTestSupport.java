package work.isu.core.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import work.isu.core.canon.Canonicalizer;
import work.isu.core.model.Program;
import work.isu.core.parse.IsuParser;

/**
 * Shared helpers for the test suites: locate the sample programs under
 * {@code src/test/resources} and run the front half of the pipeline.
 */
public final class IsuTestSupport {
    private IsuTestSupport() {}

    public static Path resources() {
        return Path.of("src", "test", "resources").toAbsolutePath();
    }

    public static Path programPath(String name) {
        return resources().resolve("programs").resolve(name);
    }

    public static String source(String name) {
        try {
            return Files.readString(programPath(name), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static Program canonical(String text) {
        return Canonicalizer.canonicalize(IsuParser.parse(text));
    }

    public static Program program(String name) {
        return canonical(source(name));
    }

    /**
     * Wraps {@code steps} into a program with AUTO_ID on. {@code local} is the body of the
     * {@code LOCAL} section, one {@code - name: type} per line.
     */
    public static String autoIdProgram(String returns, String inputs, String local, String steps) {
        return String.join("\n",
            "META:",
            "  AUTO_ID: true",
            "FUNC:",
            "  NAME: test",
            "  RETURNS: " + returns,
            "IO:",
            "  INPUT: " + inputs,
            "  OUTPUT: []",
            "STATE: []",
            local.isBlank() ? "LOCAL: []" : "LOCAL:\n" + local,
            "STEPS:",
            "  SEQ: BEGIN",
            steps,
            "  END",
            ""
        );
    }
}
