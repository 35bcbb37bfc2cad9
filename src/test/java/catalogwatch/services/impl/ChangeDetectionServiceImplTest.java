package catalogwatch.services.impl;

import static catalogwatch.support.CatalogFixtures.*;
import static org.assertj.core.api.Assertions.*;

import catalogwatch.config.CrawlerSettings;
import catalogwatch.dto.change.DetectionSummary;
import catalogwatch.exception.BookValidationException;
import catalogwatch.model.Book;
import catalogwatch.model.BookChange;
import catalogwatch.model.ChangeType;
import catalogwatch.support.FakePageLoader;
import catalogwatch.support.InMemoryCatalogStore;
import catalogwatch.support.TestComponents;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChangeDetectionServiceImplTest {
    private static final String URL = bookUrl("a-light-in-the-attic_1000");

    private InMemoryCatalogStore store;
    private FakePageLoader loader;
    private ChangeDetectionServiceImpl service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        loader = new FakePageLoader();
        service = new ChangeDetectionServiceImpl(store, loader, TestComponents.bookParser(),
                TestComponents.bookValidator(), TestComponents.crawlerSettings());
    }

    private static Book book(String price, String availability, int rating, int reviews) {
        return new Book(URL, "A Light in the Attic", "Poetry", new BigDecimal(price), new BigDecimal(price),
                availability, reviews, null, rating);
    }

    private Book stored(String price, String availability, int rating, int reviews) {
        Book book = book(price, availability, rating, reviews);
        store.insertBook(book);
        return book;
    }

    @Test
    void testCompareAndLog_NoDifference() {
        // Given
        Book stored = stored("10.99", "In stock (5 available)", 3, 0);
        DetectionSummary summary = new DetectionSummary();

        // When
        List<BookChange> changes = service.compareAndLog(stored, book("10.99", "In stock (5 available)", 3, 0), summary);

        // Then
        assertThat(changes).isEmpty();
        assertThat(store.changes()).isEmpty();
        assertThat(summary.getUnchanged()).isEqualTo(1);
        assertThat(summary.getTotalChanges()).isZero();
    }

    @Test
    void testCompareAndLog_PriceOnly() {
        // Given
        Book stored = stored("10.99", "In stock (5 available)", 3, 0);
        DetectionSummary summary = new DetectionSummary();

        // When
        List<BookChange> changes = service.compareAndLog(stored, book("8.99", "In stock (5 available)", 3, 0), summary);

        // Then
        assertThat(changes).singleElement().satisfies(change -> {
            assertThat(change.getChangeType()).isEqualTo(ChangeType.PRICE_CHANGE);
            assertThat(change.getOldValue()).isEqualTo("10.99");
            assertThat(change.getNewValue()).isEqualTo("8.99");
            assertThat(change.getBookUrl()).isEqualTo(URL);
            assertThat(change.getDetectedBy()).isEqualTo(BookChange.DETECTED_BY_SCHEDULER);
        });
        assertThat(summary.getPriceChanges()).isEqualTo(1);
        assertThat(summary.getUpdated()).isEqualTo(1);
        assertThat(stored.getPriceInclTax()).isEqualByComparingTo("8.99");
        assertThat(stored.getContentHash()).isEqualTo(stored.computeContentHash());
    }

    @Test
    void testCompareAndLog_ThreeFieldsInFixedOrder() {
        // Given
        Book stored = stored("10.99", "In stock (5 available)", 3, 2);
        DetectionSummary summary = new DetectionSummary();

        // When
        List<BookChange> changes = service.compareAndLog(stored, book("8.99", "Out of stock", 5, 2), summary);

        // Then
        assertThat(changes).extracting(BookChange::getChangeType)
                .containsExactly(ChangeType.PRICE_CHANGE, ChangeType.AVAILABILITY_CHANGE, ChangeType.RATING_CHANGE);
        assertThat(changes).extracting(BookChange::getOldValue).containsExactly("10.99", "In stock (5 available)", "3");
        assertThat(changes).extracting(BookChange::getNewValue).containsExactly("8.99", "Out of stock", "5");
        assertThat(summary.getPriceChanges()).isEqualTo(1);
        assertThat(summary.getAvailabilityChanges()).isEqualTo(1);
        assertThat(summary.getRatingChanges()).isEqualTo(1);
        assertThat(summary.getReviewsChanges()).isZero();
        assertThat(summary.getTotalChanges()).isEqualTo(3);
        assertThat(store.changes()).hasSize(3);
    }

    @Test
    void testCompareAndLog_ReviewCount() {
        Book stored = stored("10.99", "In stock", 3, 0);
        DetectionSummary summary = new DetectionSummary();

        List<BookChange> changes = service.compareAndLog(stored, book("10.99", "In stock", 3, 4), summary);

        assertThat(changes).extracting(BookChange::getChangeType).containsExactly(ChangeType.REVIEWS_CHANGE);
        assertThat(summary.getReviewsChanges()).isEqualTo(1);
        assertThat(stored.getNumReviews()).isEqualTo(4);
    }

    @Test
    void testRunCycle_DetectsPriceDrop() {
        // Given
        stored("10.99", "In stock (22 available)", 3, 0);
        loader.page(URL, bookPage("A Light in the Attic", "Poetry", "£8.99"));

        // When
        DetectionSummary summary = service.runChangeDetectionCycle();

        // Then
        assertThat(summary.getChecked()).isEqualTo(1);
        assertThat(summary.getUpdated()).isEqualTo(1);
        assertThat(summary.getPriceChanges()).isEqualTo(1);
        assertThat(summary.getFinishedAt()).isNotNull();
        assertThat(store.findBookByUrl(URL)).get()
                .extracting(Book::getPriceInclTax).isEqualTo(new BigDecimal("8.99"));
    }

    @Test
    void testRunCycle_UnchangedTakesHashFastPath() {
        Book stored = stored("10.99", "In stock (22 available)", 3, 0);
        String hash = stored.getContentHash();
        loader.page(URL, bookPage("A Light in the Attic", "Poetry", "£10.99"));

        DetectionSummary summary = service.runChangeDetectionCycle();

        assertThat(summary.getUnchanged()).isEqualTo(1);
        assertThat(summary.hasChanges()).isFalse();
        assertThat(store.changes()).isEmpty();
        assertThat(stored.getContentHash()).isEqualTo(hash);
    }

    @Test
    void testRunCycle_UnavailableBookIsLeftAlone() {
        // Given
        Book stored = stored("10.99", "In stock (22 available)", 3, 0);
        String hash = stored.getContentHash();

        // When
        DetectionSummary summary = service.runChangeDetectionCycle();

        // Then
        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(store.changes()).isEmpty();
        assertThat(stored.getContentHash()).isEqualTo(hash);
        assertThat(stored.getPriceInclTax()).isEqualByComparingTo("10.99");
    }

    @Test
    void testRunCycle_UnparsablePageIsSkipped() {
        stored("10.99", "In stock (22 available)", 3, 0);
        loader.page(URL, "<html><body>maintenance</body></html>");

        DetectionSummary summary = service.runChangeDetectionCycle();

        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(store.changes()).isEmpty();
    }

    @Test
    void testRunCycle_HugeStockCountDoesNotStopOtherBooks() {
        // Given
        String otherUrl = bookUrl("tipping-the-velvet_999");
        stored("10.99", "In stock (99999999999 available)", 3, 0);
        Book other = new Book(otherUrl, "Tipping the Velvet", "Poetry", new BigDecimal("11.00"),
                new BigDecimal("11.00"), "In stock (22 available)", 0, null, 3);
        store.insertBook(other);
        loader.page(URL, bookPage("A Light in the Attic", "Poetry", "£10.99", "£10.99",
                        "In stock (5 available)", 0, "Three"))
                .page(otherUrl, bookPage("Tipping the Velvet", "Poetry", "£9.00"));

        // When
        DetectionSummary summary = service.runChangeDetectionCycle();

        // Then
        assertThat(summary.getChecked()).isEqualTo(2);
        assertThat(summary.getUpdated()).isEqualTo(2);
        assertThat(summary.getAvailabilityChanges()).isEqualTo(1);
        assertThat(summary.getPriceChanges()).isEqualTo(1);
        assertThat(store.changes()).filteredOn(change -> change.getBookUrl().equals(otherUrl))
                .singleElement().satisfies(change -> {
                    assertThat(change.getChangeType()).isEqualTo(ChangeType.PRICE_CHANGE);
                    assertThat(change.getOldValue()).isEqualTo("11.00");
                    assertThat(change.getNewValue()).isEqualTo("9.00");
                });
    }

    @Test
    void testRunCycle_FailingBookIsSkippedAndCycleContinues() {
        // Given
        String otherUrl = bookUrl("tipping-the-velvet_999");
        InMemoryCatalogStore failingStore = new InMemoryCatalogStore() {
            @Override
            public synchronized BookChange appendChange(BookChange change) {
                if (change.getBookUrl().equals(URL)) {
                    throw new IllegalStateException("change log unavailable");
                }
                return super.appendChange(change);
            }
        };
        service = new ChangeDetectionServiceImpl(failingStore, loader, TestComponents.bookParser(),
                TestComponents.bookValidator(), TestComponents.crawlerSettings());
        failingStore.insertBook(book("10.99", "In stock (22 available)", 3, 0));
        failingStore.insertBook(new Book(otherUrl, "Tipping the Velvet", "Poetry", new BigDecimal("11.00"),
                new BigDecimal("11.00"), "In stock (22 available)", 0, null, 3));
        loader.page(URL, bookPage("A Light in the Attic", "Poetry", "£8.99"))
                .page(otherUrl, bookPage("Tipping the Velvet", "Poetry", "£9.00"));

        // When
        DetectionSummary summary = service.runChangeDetectionCycle();

        // Then
        assertThat(summary.getChecked()).isEqualTo(2);
        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(summary.getUpdated()).isEqualTo(1);
        assertThat(failingStore.changes()).singleElement()
                .extracting(BookChange::getBookUrl).isEqualTo(otherUrl);
    }

    @Test
    void testDetectNewBook() {
        // Given
        Book fresh = book("12.50", "In stock", 4, 0);

        // When
        boolean created = service.detectNewBook(fresh, BookChange.DETECTED_BY_SCHEDULER);

        // Then
        assertThat(created).isTrue();
        assertThat(store.countBooks()).isEqualTo(1);
        assertThat(store.changes()).singleElement().satisfies(change -> {
            assertThat(change.getChangeType()).isEqualTo(ChangeType.NEW_BOOK);
            assertThat(change.getOldValue()).isNull();
            assertThat(change.getNewValue())
                    .isEqualTo("{\"title\":\"A Light in the Attic\",\"category\":\"Poetry\",\"price\":\"12.50\"}");
            assertThat(change.getDetectedBy()).isEqualTo(BookChange.DETECTED_BY_SCHEDULER);
        });
        assertThat(service.detectNewBook(book("12.50", "In stock", 4, 0), BookChange.DETECTED_BY_SCHEDULER)).isFalse();
        assertThat(store.changes()).hasSize(1);
    }

    @Test
    void testDetectNewBook_RecordingDisabled() {
        CrawlerSettings settings = TestComponents.crawlerSettings();
        settings.setRecordNewBooks(false);
        service = new ChangeDetectionServiceImpl(store, loader, TestComponents.bookParser(),
                TestComponents.bookValidator(), settings);

        assertThat(service.detectNewBook(book("12.50", "In stock", 4, 0), BookChange.DETECTED_BY_CRAWLER)).isTrue();
        assertThat(store.countBooks()).isEqualTo(1);
        assertThat(store.changes()).isEmpty();
    }

    @Test
    void testDetectNewBook_InvalidBookIsRejected() {
        Book invalid = new Book(URL, " ", "Poetry", new BigDecimal("12.50"), new BigDecimal("12.50"),
                "In stock", 0, null, 4);

        assertThatThrownBy(() -> service.detectNewBook(invalid, BookChange.DETECTED_BY_CRAWLER))
                .isInstanceOf(BookValidationException.class);
        assertThat(store.countBooks()).isZero();
        assertThat(store.changes()).isEmpty();
    }
}
