package catalogwatch.services.impl;

import catalogwatch.dto.crawl.CrawlStats;
import catalogwatch.dto.parse.BookParseResult;
import catalogwatch.exception.BookValidationException;
import catalogwatch.model.Book;
import catalogwatch.model.BookChange;
import catalogwatch.services.CatalogStore;
import catalogwatch.services.ChangeDetectionService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RecursiveAction;

/**
 * Fetches, parses, validates and stores the books of one index page. The root task forks
 * one subtask per URL and returns once all of them are done.
 */
@Slf4j
public class BookCrawlTask extends RecursiveAction {
    private final List<String> bookUrls;
    private final String category;
    private final Context context;

    /**
     * Collaborators shared by every task of a run.
     */
    public record Context(PageFetcher pageFetcher,
                          BookParser bookParser,
                          CatalogStore catalogStore,
                          ChangeDetectionService changeDetectionService,
                          boolean recordNewBooks,
                          CrawlStats stats) {
    }

    public BookCrawlTask(List<String> bookUrls, String category, Context context) {
        this.bookUrls = bookUrls;
        this.category = category;
        this.context = context;
    }

    @Override
    protected void compute() {
        if (bookUrls.size() == 1) {
            crawlBook(bookUrls.get(0));
            return;
        }
        List<BookCrawlTask> subTasks = new ArrayList<>();
        for (String url : bookUrls) {
            subTasks.add(new BookCrawlTask(List.of(url), category, context));
        }
        invokeAll(subTasks);
    }

    private void crawlBook(String url) {
        CrawlStats stats = context.stats();
        try {
            if (context.catalogStore().findBookByUrl(url).isPresent()) {
                log.debug("Skipping stored book {}", url);
                stats.getDuplicatesSkipped().incrementAndGet();
                return;
            }
            String html = context.pageFetcher().fetchOrNull(url);
            if (html == null) {
                stats.getFailed().incrementAndGet();
                return;
            }
            stats.getBooksFetched().incrementAndGet();

            BookParseResult result = context.bookParser().parse(html, url);
            if (!result.isSuccess()) {
                log.warn("Skipping {}: {}", url, result.getError());
                stats.getFailed().incrementAndGet();
                return;
            }
            Book book = result.getBook();
            book.setCategory(category);

            if (!context.changeDetectionService().detectNewBook(book, BookChange.DETECTED_BY_CRAWLER)) {
                stats.getDuplicatesSkipped().incrementAndGet();
                return;
            }
            stats.getBooksStored().incrementAndGet();
            if (context.recordNewBooks()) {
                stats.getNewBooks().incrementAndGet();
            }
        } catch (BookValidationException ex) {
            log.warn(ex.getMessage());
            stats.getFailed().incrementAndGet();
        } catch (RuntimeException ex) {
            log.error("Error crawling book {}", url, ex);
            stats.getFailed().incrementAndGet();
        }
    }
}
