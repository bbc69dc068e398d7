package ai.storygen.chapters.model;

import java.util.List;
import java.util.Objects;

/**
 * A validated, ordered chapter list together with the title of the book it belongs to.
 */
public record Book(String title, List<Chapter> chapters) {

    public Book {
        Objects.requireNonNull(title, "title");
        if (title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        chapters = List.copyOf(Objects.requireNonNull(chapters, "chapters"));
    }
}
