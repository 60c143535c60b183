package work.isu.core.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.isu.core.api.IsuRunConfiguration;
import work.isu.core.api.IsuRunner;
import work.isu.core.api.IsuSettings;
import work.isu.core.api.LogLevel;
import work.isu.core.shared.DurationParser;

@CommandLine.Command(
    name = "run",
    description = "Validate and interpret an Isu program with JSON inputs.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Isu source file.")
    private Path file;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|JSON|-",
        description = "Input bindings: a JSON file, inline JSON object, or '-' for stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = "--config",
        description = "Settings file (default: isu.toml next to FILE, if present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--timeout",
        description = "Interpretation timeout (e.g. 500ms, 30s, 1m30s).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--max-iterations",
        description = "Total loop iterations allowed (0 = unlimited).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Long maxIterations;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--cache",
        negatable = true,
        description = "Memoise canonical programs by source text.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Boolean cache;

    @Override
    public Integer call() throws Exception {
        var builder = IsuRunConfiguration.builder()
            .source(file.toAbsolutePath().normalize())
            .inputPayload(loadInputPayload());
        settings().applyTo(builder);
        if (timeoutRaw != null) {
            builder.timeout(DurationParser.parse(timeoutRaw));
        }
        if (maxIterations != null) {
            builder.maxIterations(maxIterations);
        }
        String level = logLevelRaw != null ? logLevelRaw : System.getenv("ISU_LOG_LEVEL");
        if (level != null && !level.isBlank()) {
            builder.logLevel(LogLevel.from(level));
        }
        if (cache != null) {
            builder.cache(cache);
        }
        var result = new IsuRunner().run(builder.build());
        var out = spec.commandLine().getOut();
        out.println(result.toPrettyJson());
        out.flush();
        return result.status().exitCode();
    }

    private IsuSettings settings() throws IOException {
        if (config != null) {
            return IsuSettings.load(config);
        }
        return IsuSettings.discover(file.toAbsolutePath().normalize().getParent());
    }

    private String loadInputPayload() {
        if (input == null || input.isBlank()) {
            return "{}";
        }
        if ("-".equals(input)) {
            try {
                return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input from stdin: " + ex.getMessage());
            }
        }
        String trimmed = input.trim();
        if (trimmed.startsWith("{")) {
            return trimmed;
        }
        Path path = Path.of(input).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + path);
        }
        return SourceFiles.read(spec, path);
    }
}
