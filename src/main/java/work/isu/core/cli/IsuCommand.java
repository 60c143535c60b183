package work.isu.core.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "isu",
    description = "Parse, check, run and patch Isu programs.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        CanonCommand.class,
        CheckCommand.class,
        RunCommand.class,
        PatchCommand.class,
        TestCommand.class
    }
)
final class IsuCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
