package catalogwatch.services.impl;

import catalogwatch.config.CrawlerSettings;
import catalogwatch.dto.crawl.CrawlOutcome;
import catalogwatch.dto.crawl.CrawlStats;
import catalogwatch.dto.crawl.CrawlSummary;
import catalogwatch.dto.parse.CategoryLink;
import catalogwatch.exception.CrawlAbortedException;
import catalogwatch.exception.FetchException;
import catalogwatch.model.CrawlState;
import catalogwatch.services.CatalogStore;
import catalogwatch.services.ChangeDetectionService;
import catalogwatch.services.CrawlService;
import catalogwatch.services.PageLoaderFactory;
import catalogwatch.util.UrlResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;

@Slf4j
@Service
@RequiredArgsConstructor
public class CrawlServiceImpl implements CrawlService {
    private final CatalogStore catalogStore;
    private final PageLoaderFactory pageLoaderFactory;
    private final BookParser bookParser;
    private final ChangeDetectionService changeDetectionService;
    private final UrlResolver urlResolver;
    private final CrawlerSettings crawlerSettings;

    @Override
    public CrawlSummary runCrawl(boolean resume) {
        LocalDateTime startedAt = LocalDateTime.now();
        CrawlStats stats = new CrawlStats();
        PageFetcher pageFetcher = new PageFetcher(pageLoaderFactory.openSession(), crawlerSettings.retryPolicy());
        ForkJoinPool pool = new ForkJoinPool(crawlerSettings.getConcurrency());
        BookCrawlTask.Context context = new BookCrawlTask.Context(pageFetcher, bookParser, catalogStore,
                changeDetectionService, crawlerSettings.isRecordNewBooks(), stats);

        log.info("Crawl started (resume={}, concurrency={})", resume, crawlerSettings.getConcurrency());
        try {
            Optional<CrawlState> previous = resume
                    ? catalogStore.getCrawlState(CrawlState.DEFAULT_TYPE)
                    : Optional.empty();
            previous.ifPresent(saved -> log.info("Resuming crawl from category '{}' page {}",
                    saved.getLastCategory(), saved.getLastPage()));
            CrawlState state = previous.orElseGet(() -> new CrawlState(CrawlState.DEFAULT_TYPE, startedAt));
            int crawledBefore = previous.map(CrawlState::getTotalCrawled).orElse(0);

            List<CategoryLink> categories = fetchCategories(pageFetcher);
            String resumeCategory = previous.map(CrawlState::getLastCategory).orElse(null);
            boolean skipping = resumeCategory != null;

            for (CategoryLink category : categories) {
                int startPage = 1;
                if (skipping) {
                    if (!category.name().equals(resumeCategory)) {
                        log.debug("Skipping category '{}' until '{}'", category.name(), resumeCategory);
                        continue;
                    }
                    skipping = false;
                    startPage = Math.max(state.getLastPage(), 1);
                }
                crawlCategory(category, startPage, pageFetcher, pool, context, state, crawledBefore);
                stats.getCategoriesCrawled().incrementAndGet();
            }
            if (skipping) {
                log.warn("Saved category '{}' not found in the category list; nothing was resumed", resumeCategory);
            }

            catalogStore.deleteCrawlState(CrawlState.DEFAULT_TYPE);
            CrawlSummary summary = CrawlSummary.of(stats, CrawlOutcome.COMPLETED, null, startedAt, LocalDateTime.now());
            log.info("Crawl completed: {}", summary);
            return summary;
        } catch (CrawlAbortedException ex) {
            log.error("Crawl interrupted: {}", ex.getMessage());
            return CrawlSummary.of(stats, CrawlOutcome.INTERRUPTED, ex.getMessage(), startedAt, LocalDateTime.now());
        } catch (RuntimeException ex) {
            log.error("Crawl interrupted by unexpected error", ex);
            return CrawlSummary.of(stats, CrawlOutcome.INTERRUPTED, String.valueOf(ex.getMessage()),
                    startedAt, LocalDateTime.now());
        } finally {
            pool.shutdown();
        }
    }

    private List<CategoryLink> fetchCategories(PageFetcher pageFetcher) {
        String rootUrl = urlResolver.getBaseUrl();
        try {
            return bookParser.parseCategoryIndex(pageFetcher.fetch(rootUrl).html());
        } catch (FetchException ex) {
            throw new CrawlAbortedException("Failed to fetch main page " + rootUrl, ex);
        }
    }

    private void crawlCategory(CategoryLink category,
                               int startPage,
                               PageFetcher pageFetcher,
                               ForkJoinPool pool,
                               BookCrawlTask.Context context,
                               CrawlState state,
                               int crawledBefore) {
        log.info("Crawling category '{}' from page {}", category.name(), startPage);
        CrawlStats stats = context.stats();
        int page = startPage;
        String pageUrl = UrlResolver.pageUrl(category.url(), startPage);

        while (true) {
            String html;
            try {
                html = pageFetcher.fetch(pageUrl).html();
            } catch (FetchException ex) {
                throw new CrawlAbortedException("Failed to fetch page " + page + " of category '"
                        + category.name() + "': " + pageUrl, ex);
            }

            List<String> bookUrls = bookParser.parseIndexPage(html);
            if (bookUrls.isEmpty()) {
                log.info("No books on page {} of '{}', category done", page, category.name());
                return;
            }
            pool.invoke(new BookCrawlTask(bookUrls, category.name(), context));
            stats.getPagesCrawled().incrementAndGet();

            state.recordProgress(category.name(), bookUrls.get(bookUrls.size() - 1), page,
                    crawledBefore + stats.getBooksStored().get());
            catalogStore.upsertCrawlState(state);
            log.info("Page {} of '{}' done: {} books listed, {} stored so far",
                    page, category.name(), bookUrls.size(), stats.getBooksStored().get());

            Optional<String> next = bookParser.nextPageUrl(html);
            if (next.isEmpty()) {
                return;
            }
            pageUrl = UrlResolver.resolveSibling(pageUrl, next.get());
            page++;
        }
    }
}
