package ai.storygen.chapters.cli;

import ai.storygen.chapters.config.InputFormat;
import ai.storygen.chapters.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "story-chapter-extractor", mixinStandardHelpOptions = true, version = "0.1.0",
        description = "Extracts numbered chapters from HTML and EPUB books into plain text")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "PATH", arity = "0..*",
            description = "Files or directories to read; directories are searched recursively")
    private List<Path> inputPaths = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--outdir"}, description = "Directory the extracted books are written to", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--format", description = "Input format: html, epub or text", converter = InputFormatConverter.class)
    private InputFormat inputFormat;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-d", "--debug"}, description = "Enable debug logging")
    private boolean debug;

    @CommandLine.Option(names = "--fail-fast", description = "Stop at the first book that cannot be extracted")
    private boolean failFast;

    public List<Path> inputPaths() {
        return inputPaths;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public InputFormat inputFormat() {
        return inputFormat;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean debug() {
        return debug;
    }

    public boolean failFast() {
        return failFast;
    }
}
