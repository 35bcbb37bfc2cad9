package catalogwatch.services.impl;

import catalogwatch.config.CrawlerSettings;
import catalogwatch.dto.change.DetectionSummary;
import catalogwatch.dto.parse.BookParseResult;
import catalogwatch.exception.BookValidationException;
import catalogwatch.model.Book;
import catalogwatch.model.BookChange;
import catalogwatch.model.ChangeType;
import catalogwatch.services.CatalogStore;
import catalogwatch.services.ChangeDetectionService;
import catalogwatch.services.PageLoaderFactory;
import catalogwatch.util.FieldExtractors;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeDetectionServiceImpl implements ChangeDetectionService {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CatalogStore catalogStore;
    private final PageLoaderFactory pageLoaderFactory;
    private final BookParser bookParser;
    private final BookValidator bookValidator;
    private final CrawlerSettings crawlerSettings;

    @Override
    public DetectionSummary runChangeDetectionCycle() {
        DetectionSummary summary = new DetectionSummary();
        PageFetcher pageFetcher = new PageFetcher(pageLoaderFactory.openSession(), crawlerSettings.retryPolicy());
        List<Book> books = catalogStore.listAllBooks();
        log.info("Change detection started for {} books", books.size());

        for (Book stored : books) {
            summary.setChecked(summary.getChecked() + 1);
            try {
                Optional<Book> fresh = fetchFresh(pageFetcher, stored);
                if (fresh.isEmpty()) {
                    summary.setSkipped(summary.getSkipped() + 1);
                    continue;
                }
                compareAndLog(stored, fresh.get(), summary);
            } catch (RuntimeException ex) {
                log.error("Error checking {}, skipped for this cycle", stored.getUrl(), ex);
                summary.setSkipped(summary.getSkipped() + 1);
            }
        }

        summary.setFinishedAt(LocalDateTime.now());
        log.info("Change detection finished: checked={}, unchanged={}, updated={}, skipped={}, changes={}",
                summary.getChecked(), summary.getUnchanged(), summary.getUpdated(), summary.getSkipped(),
                summary.getTotalChanges());
        return summary;
    }

    @Override
    public List<BookChange> compareAndLog(Book stored, Book fresh, DetectionSummary summary) {
        String freshHash = fresh.refreshContentHash();
        if (Objects.equals(stored.getContentHash(), freshHash)) {
            summary.setUnchanged(summary.getUnchanged() + 1);
            return List.of();
        }

        List<BookChange> changes = new ArrayList<>();
        if (!samePrice(stored.getPriceInclTax(), fresh.getPriceInclTax())) {
            changes.add(change(stored, ChangeType.PRICE_CHANGE,
                    plain(stored.getPriceInclTax()), plain(fresh.getPriceInclTax())));
            summary.setPriceChanges(summary.getPriceChanges() + 1);
        }
        if (!Objects.equals(stored.getAvailability(), fresh.getAvailability())) {
            changes.add(change(stored, ChangeType.AVAILABILITY_CHANGE,
                    stored.getAvailability(), fresh.getAvailability()));
            summary.setAvailabilityChanges(summary.getAvailabilityChanges() + 1);
            if (log.isDebugEnabled()) {
                log.debug("Stock of {}: {} -> {}", stored.getUrl(),
                        FieldExtractors.extractAvailableCount(stored.getAvailability()),
                        FieldExtractors.extractAvailableCount(fresh.getAvailability()));
            }
        }
        if (!Objects.equals(stored.getRating(), fresh.getRating())) {
            changes.add(change(stored, ChangeType.RATING_CHANGE,
                    String.valueOf(stored.getRating()), String.valueOf(fresh.getRating())));
            summary.setRatingChanges(summary.getRatingChanges() + 1);
        }
        if (!Objects.equals(stored.getNumReviews(), fresh.getNumReviews())) {
            changes.add(change(stored, ChangeType.REVIEWS_CHANGE,
                    String.valueOf(stored.getNumReviews()), String.valueOf(fresh.getNumReviews())));
            summary.setReviewsChanges(summary.getReviewsChanges() + 1);
        }

        List<BookChange> saved = new ArrayList<>();
        for (BookChange change : changes) {
            saved.add(catalogStore.appendChange(change));
            log.info("{} for '{}': {} -> {}", change.getChangeType().getCode(), stored.getTitle(),
                    change.getOldValue(), change.getNewValue());
        }

        // untracked fields such as the title may still differ, keep the snapshot current
        fresh.setStatus(stored.getStatus());
        fresh.setCategory(stored.getCategory());
        catalogStore.replaceBook(stored, fresh);
        if (saved.isEmpty()) {
            summary.setUnchanged(summary.getUnchanged() + 1);
        } else {
            summary.setUpdated(summary.getUpdated() + 1);
        }
        return saved;
    }

    @Override
    public boolean detectNewBook(Book fresh, String detectedBy) {
        bookValidator.validate(fresh);
        if (!catalogStore.insertBook(fresh)) {
            return false;
        }
        if (crawlerSettings.isRecordNewBooks()) {
            recordNewBook(fresh, detectedBy);
        }
        return true;
    }

    private BookChange recordNewBook(Book book, String detectedBy) {
        BookChange change = BookChange.builder()
                .bookUrl(book.getUrl())
                .changeType(ChangeType.NEW_BOOK)
                .newValue(newBookSummary(book))
                .detectedBy(detectedBy)
                .build();
        log.info("New book: {}", book.getTitle());
        return catalogStore.appendChange(change);
    }

    private Optional<Book> fetchFresh(PageFetcher pageFetcher, Book stored) {
        String html = pageFetcher.fetchOrNull(stored.getUrl());
        if (html == null) {
            log.warn("Skipping {}: unavailable", stored.getUrl());
            return Optional.empty();
        }
        BookParseResult result = bookParser.parse(html, stored.getUrl());
        if (!result.isSuccess()) {
            log.warn("Skipping {}: {}", stored.getUrl(), result.getError());
            return Optional.empty();
        }
        Book fresh = result.getBook();
        try {
            bookValidator.validate(fresh);
        } catch (BookValidationException ex) {
            log.warn("Skipping {}: {}", stored.getUrl(), ex.getMessage());
            return Optional.empty();
        }
        return Optional.of(fresh);
    }

    private BookChange change(Book stored, ChangeType type, String oldValue, String newValue) {
        return BookChange.builder()
                .book(stored)
                .bookUrl(stored.getUrl())
                .changeType(type)
                .oldValue(oldValue)
                .newValue(newValue)
                .detectedBy(BookChange.DETECTED_BY_SCHEDULER)
                .build();
    }

    private static boolean samePrice(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.compareTo(right) == 0;
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String newBookSummary(Book book) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("title", book.getTitle());
        summary.put("category", book.getCategory());
        summary.put("price", plain(book.getPriceInclTax()));
        try {
            return MAPPER.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise new book summary", e);
        }
    }
}
