package work.isu.core.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.isu.core.api.IsuPipeline;
import work.isu.core.json.IirJson;

@CommandLine.Command(
    name = "patch",
    description = "Apply a PATCH/REPLACE file to an Isu program and print the patched canonical program.",
    mixinStandardHelpOptions = true
)
final class PatchCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Isu source file.")
    private Path file;

    @CommandLine.Parameters(index = "1", paramLabel = "PATCH", description = "File holding one PATCH block.")
    private Path patchFile;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write the patched program here instead of stdout.")
    private Path output;

    @CommandLine.Option(names = "--json", description = "Print canonical IIR as JSON instead of Isu text.")
    private boolean json;

    @Override
    public Integer call() {
        var pipeline = new IsuPipeline();
        var program = pipeline.load(SourceFiles.read(spec, file));
        var outcome = pipeline.patch(program, SourceFiles.read(spec, patchFile));
        String rendered = json ? IirJson.write(outcome.program()) + System.lineSeparator() : outcome.canonicalText();
        if (output != null) {
            SourceFiles.write(spec, output, rendered);
        } else {
            var out = spec.commandLine().getOut();
            out.print(rendered);
            out.flush();
        }
        return 0;
    }
}
