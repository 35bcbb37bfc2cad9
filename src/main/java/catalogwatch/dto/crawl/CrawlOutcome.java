package catalogwatch.dto.crawl;

public enum CrawlOutcome {
    COMPLETED,
    INTERRUPTED
}
