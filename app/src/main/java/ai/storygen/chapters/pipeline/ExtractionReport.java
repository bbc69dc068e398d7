package ai.storygen.chapters.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a run: the files written and the books that could not be extracted.
 */
public record ExtractionReport(List<Path> writtenFiles, List<Failure> failures) {

    public ExtractionReport {
        writtenFiles = List.copyOf(Objects.requireNonNull(writtenFiles, "writtenFiles"));
        failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * A book that was skipped, with the reason.
     */
    public record Failure(String book, String reason) {

        public Failure {
            Objects.requireNonNull(book, "book");
            Objects.requireNonNull(reason, "reason");
        }
    }
}
