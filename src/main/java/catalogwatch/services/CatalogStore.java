package catalogwatch.services;

import catalogwatch.model.Book;
import catalogwatch.model.BookChange;
import catalogwatch.model.CrawlState;

import java.util.List;
import java.util.Optional;

/**
 * Storage used by the crawler and the change detector: books keyed by URL, the append-only
 * change log and the crawl resume marker.
 */
public interface CatalogStore {

    /**
     * Inserts the book unless its URL is already stored.
     *
     * @return false when another row with the same URL exists
     */
    boolean insertBook(Book book);

    Optional<Book> findBookByUrl(String url);

    List<Book> listAllBooks();

    long countBooks();

    /**
     * Overwrites the mutable fields of the stored book with those of {@code fresh}; the URL stays.
     */
    Book replaceBook(Book stored, Book fresh);

    BookChange appendChange(BookChange change);

    /**
     * Most recent changes first.
     */
    List<BookChange> listRecentChanges(int limit);

    Optional<CrawlState> getCrawlState(String stateType);

    CrawlState upsertCrawlState(CrawlState state);

    void deleteCrawlState(String stateType);
}
