package catalogwatch.dto.crawl;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters shared by the workers of one crawl run.
 */
@Getter
public class CrawlStats {
    private final AtomicInteger categoriesCrawled = new AtomicInteger();
    private final AtomicInteger pagesCrawled = new AtomicInteger();
    private final AtomicInteger booksFetched = new AtomicInteger();
    private final AtomicInteger booksStored = new AtomicInteger();
    private final AtomicInteger duplicatesSkipped = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger newBooks = new AtomicInteger();
}
