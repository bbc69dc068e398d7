package ai.storygen.chapters.cli;

import ai.storygen.chapters.config.Config;
import ai.storygen.chapters.config.ConfigLoader;
import ai.storygen.chapters.config.SystemEnvironmentReader;
import ai.storygen.chapters.logging.LoggingConfigurator;
import ai.storygen.chapters.model.ChapterExtractionException;
import ai.storygen.chapters.pipeline.BookExtractionService;
import ai.storygen.chapters.pipeline.ExtractionReport;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and extraction pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_BOOK_FAILED = 1;

    private final ConfigLoader configLoader;
    private final BookExtractionService extractionService;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new BookExtractionService());
    }

    CliApplication(ConfigLoader configLoader, BookExtractionService extractionService) {
        this.configLoader = configLoader;
        this.extractionService = extractionService;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.logLevel());
        LOGGER.debug("Writing {} output to {} (failFast={})", config.inputFormat(), config.outputDirectory(), config.failFast());

        try {
            ExtractionReport report = extractionService.run(config);
            if (report.hasFailures()) {
                report.failures().forEach(failure -> LOGGER.warn("Not extracted: {} ({})", failure.book(), failure.reason()));
                return EXIT_BOOK_FAILED;
            }
            return 0;
        } catch (ChapterExtractionException | UncheckedIOException ex) {
            LOGGER.error("Aborting: {}", ex.getMessage());
            return EXIT_BOOK_FAILED;
        }
    }
}
