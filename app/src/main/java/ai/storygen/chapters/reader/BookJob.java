package ai.storygen.chapters.reader;

import ai.storygen.chapters.model.Book;
import java.io.IOException;

/**
 * A logical book that can be extracted independently of the other books of a run.
 */
public interface BookJob {

    /**
     * MDC key holding the document being segmented while a job runs.
     */
    String MDC_SOURCE = "source";

    /**
     * Human-readable identification used in logs, e.g. the book title or archive path.
     */
    String label();

    Book extract() throws IOException;
}
