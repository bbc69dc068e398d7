package ai.storygen.chapters.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Runtime exception signalling that a document or book cannot be turned into a valid chapter list.
 */
public class ChapterExtractionException extends RuntimeException {

    private final ExtractionErrorKind kind;
    private final String source;

    public ChapterExtractionException(ExtractionErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ChapterExtractionException(ExtractionErrorKind kind, String message, String source) {
        this(kind, message, source, null);
    }

    private ChapterExtractionException(ExtractionErrorKind kind, String message, String source, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.source = source;
    }

    public ExtractionErrorKind kind() {
        return kind;
    }

    public Optional<String> source() {
        return Optional.ofNullable(source);
    }

    /**
     * Attaches the identifier of the document being processed unless one is already known.
     */
    public ChapterExtractionException inSource(String documentSource) {
        if (source != null) {
            return this;
        }
        return new ChapterExtractionException(kind, getMessage(), documentSource, this);
    }

    @Override
    public String toString() {
        String prefix = getClass().getSimpleName() + "[" + kind + "]";
        String location = source == null ? "" : " in " + source;
        return prefix + location + ": " + getMessage();
    }
}
