package work.isu.core.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;

final class SourceFiles {
    private SourceFiles() {}

    static String read(CommandLine.Model.CommandSpec spec, Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read " + path + ": " + ex.getMessage());
        }
    }

    static void write(CommandLine.Model.CommandSpec spec, Path path, String text) {
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Cannot write " + path + ": " + ex.getMessage(), ex);
        }
    }
}
