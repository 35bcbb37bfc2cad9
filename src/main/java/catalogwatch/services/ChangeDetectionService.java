package catalogwatch.services;

import catalogwatch.dto.change.DetectionSummary;
import catalogwatch.model.Book;
import catalogwatch.model.BookChange;

import java.util.List;

public interface ChangeDetectionService {

    /**
     * Re-fetches every stored book and logs what changed since the stored snapshot.
     */
    DetectionSummary runChangeDetectionCycle();

    /**
     * Diffs the tracked fields of {@code stored} and {@code fresh}, appends one change per
     * differing field and replaces the stored snapshot when anything changed.
     */
    List<BookChange> compareAndLog(Book stored, Book fresh, DetectionSummary summary);

    /**
     * Validates and stores {@code fresh} unless its URL is stored already. A stored book also
     * gets a new_book change unless {@code catalog.crawler.record-new-books} is off.
     *
     * @return true when the book was stored
     * @throws catalogwatch.exception.BookValidationException when the book breaks a constraint
     */
    boolean detectNewBook(Book fresh, String detectedBy);
}
