package work.isu.core.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.isu.core.api.IsuPipeline;
import work.isu.core.json.IirJson;

@CommandLine.Command(
    name = "canon",
    description = "Print the canonical form of an Isu program.",
    mixinStandardHelpOptions = true
)
final class CanonCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Isu source file.")
    private Path file;

    @CommandLine.Option(names = "--json", description = "Print canonical IIR as key-ordered JSON instead of Isu text.")
    private boolean json;

    @Override
    public Integer call() {
        var pipeline = new IsuPipeline();
        var program = pipeline.canonicalize(SourceFiles.read(spec, file));
        var out = spec.commandLine().getOut();
        if (json) {
            out.println(IirJson.write(program));
        } else {
            out.print(pipeline.print(program));
        }
        out.flush();
        return 0;
    }
}
