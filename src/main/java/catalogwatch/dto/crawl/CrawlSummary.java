package catalogwatch.dto.crawl;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

@Value
@Builder
public class CrawlSummary {
    CrawlOutcome outcome;
    String error;
    LocalDateTime startedAt;
    LocalDateTime finishedAt;
    int categoriesCrawled;
    int pagesCrawled;
    int booksFetched;
    int booksStored;
    int duplicatesSkipped;
    int failed;
    int newBooks;

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    public static CrawlSummary of(CrawlStats stats, CrawlOutcome outcome, String error,
                                  LocalDateTime startedAt, LocalDateTime finishedAt) {
        return CrawlSummary.builder()
                .outcome(outcome)
                .error(error)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .categoriesCrawled(stats.getCategoriesCrawled().get())
                .pagesCrawled(stats.getPagesCrawled().get())
                .booksFetched(stats.getBooksFetched().get())
                .booksStored(stats.getBooksStored().get())
                .duplicatesSkipped(stats.getDuplicatesSkipped().get())
                .failed(stats.getFailed().get())
                .newBooks(stats.getNewBooks().get())
                .build();
    }
}
