package work.isu.core.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.isu.core.api.IsuPipeline;
import work.isu.core.diag.StaticError;

@CommandLine.Command(
    name = "check",
    description = "Validate an Isu program and list every static error.",
    mixinStandardHelpOptions = true
)
final class CheckCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Isu source file.")
    private Path file;

    @CommandLine.Option(names = "--json", description = "Print diagnostics as JSON.")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        var errors = new IsuPipeline().check(SourceFiles.read(spec, file));
        var out = spec.commandLine().getOut();
        if (json) {
            var list = new ArrayList<Map<String, Object>>();
            errors.forEach(error -> list.add(error.toMap()));
            out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(list));
        } else if (errors.isEmpty()) {
            out.println(file + ": ok");
        } else {
            for (StaticError error : errors) {
                out.println(file + ": " + error);
            }
        }
        out.flush();
        return errors.isEmpty() ? 0 : ShortErrorHandler.REJECTED;
    }
}
