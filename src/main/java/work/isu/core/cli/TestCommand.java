package work.isu.core.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.isu.core.api.IsuPipeline;
import work.isu.core.api.IsuLog;
import work.isu.core.fixtures.FixtureResult;
import work.isu.core.fixtures.FixtureRunner;
import work.isu.core.fixtures.TestFail;

@CommandLine.Command(
    name = "test",
    description = "Run *.fixture.yaml expected-output fixtures.",
    mixinStandardHelpOptions = true
)
final class TestCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(paramLabel = "PATH", arity = "1..*", description = "Fixture files or directories.")
    private List<Path> paths = new ArrayList<>();

    @CommandLine.Option(names = "--json", description = "Print JSON results.")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        var runner = new FixtureRunner(new IsuPipeline(true, IsuLog.silent()));
        var results = new ArrayList<FixtureResult>();
        for (Path path : paths) {
            for (Path file : FixtureRunner.discover(path)) {
                results.add(runner.run(FixtureRunner.load(file)));
            }
        }
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        if (results.isEmpty()) {
            err.println("No fixtures found under " + paths);
            return 1;
        }
        long failures = results.stream().filter(r -> !r.passed()).count();
        if (json) {
            var list = new ArrayList<Map<String, Object>>();
            for (FixtureResult result : results) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("name", result.name());
                entry.put("passed", result.passed());
                var fails = new ArrayList<Map<String, Object>>();
                result.failures().forEach(fail -> fails.add(fail.toMap()));
                entry.put("failures", fails);
                list.add(entry);
            }
            out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(list));
        } else {
            for (FixtureResult result : results) {
                if (result.passed()) {
                    out.println("PASS " + result.name());
                    continue;
                }
                err.println("FAIL " + result.name());
                for (TestFail fail : result.failures()) {
                    err.println("  " + fail.message());
                }
            }
            out.println(results.size() - failures + "/" + results.size() + " fixtures passed");
        }
        out.flush();
        err.flush();
        return failures == 0 ? 0 : 1;
    }
}
