package ai.storygen.chapters.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.storygen.chapters.config.Config;
import ai.storygen.chapters.config.ConfigLoader;
import ai.storygen.chapters.config.InputFormat;
import ai.storygen.chapters.config.LogFormat;
import ai.storygen.chapters.config.LogLevel;
import ai.storygen.chapters.pipeline.BookExtractionService;
import ai.storygen.chapters.pipeline.ExtractionReport;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CliApplicationTest {

    private static final Config CONFIG = new Config(InputFormat.HTML, List.of(Path.of("books")), Path.of("out"),
            LogFormat.TEXT, LogLevel.INFO, false);

    @Test
    void runCompletesWithSuccessWhenAllBooksAreWritten() {
        RecordingExtractionService service = new RecordingExtractionService(
                new ExtractionReport(List.of(Path.of("out/Saga.txt")), List.of()));
        CliApplication application = new CliApplication(new FixedConfigLoader(CONFIG), service);

        int exitCode = application.run(new String[] {"--outdir", "out", "books"});

        assertThat(exitCode).isZero();
        assertThat(service.invocationCount).isEqualTo(1);
    }

    @Test
    void runReportsFailedBooks() {
        RecordingExtractionService service = new RecordingExtractionService(new ExtractionReport(List.of(),
                List.of(new ExtractionReport.Failure("Saga", "OUT_OF_ORDER: Chapter is out of order"))));
        CliApplication application = new CliApplication(new FixedConfigLoader(CONFIG), service);

        int exitCode = application.run(new String[] {"--outdir", "out", "books"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_BOOK_FAILED);
    }

    @Test
    void invalidOptionsAreRejectedBeforeExtraction() {
        RecordingExtractionService service = new RecordingExtractionService(new ExtractionReport(List.of(), List.of()));
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()), service);

        assertThat(application.run(new String[] {"--format", "pdf", "books"})).isEqualTo(2);
        assertThat(application.run(new String[] {"books"})).isEqualTo(2);
        assertThat(service.invocationCount).isZero();
    }

    @Test
    void helpExitsWithoutExtraction() {
        RecordingExtractionService service = new RecordingExtractionService(new ExtractionReport(List.of(), List.of()));
        CliApplication application = new CliApplication(new FixedConfigLoader(CONFIG), service);

        assertThat(application.run(new String[] {"--help"})).isZero();
        assertThat(service.invocationCount).isZero();
    }

    private static final class RecordingExtractionService extends BookExtractionService {

        private final ExtractionReport report;
        private int invocationCount;

        RecordingExtractionService(ExtractionReport report) {
            this.report = report;
        }

        @Override
        public ExtractionReport run(Config config) {
            invocationCount++;
            return report;
        }
    }

    private static final class FixedConfigLoader extends ConfigLoader {

        private final Config config;

        FixedConfigLoader(Config config) {
            super(key -> Optional.empty());
            this.config = config;
        }

        @Override
        public Config load(CliArguments arguments) {
            return config;
        }
    }
}
