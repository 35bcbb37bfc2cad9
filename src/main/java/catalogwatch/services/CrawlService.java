package catalogwatch.services;

import catalogwatch.dto.crawl.CrawlSummary;

public interface CrawlService {

    /**
     * Walks every category page by page and stores each book not stored yet.
     *
     * @param resume continue from the saved crawl position, if any
     */
    CrawlSummary runCrawl(boolean resume);
}
