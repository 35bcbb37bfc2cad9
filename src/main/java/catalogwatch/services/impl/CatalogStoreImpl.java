package catalogwatch.services.impl;

import catalogwatch.model.Book;
import catalogwatch.model.BookChange;
import catalogwatch.model.CrawlState;
import catalogwatch.repository.BookChangeRepository;
import catalogwatch.repository.BookRepository;
import catalogwatch.repository.CrawlStateRepository;
import catalogwatch.services.CatalogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogStoreImpl implements CatalogStore {
    private final BookRepository bookRepository;
    private final BookChangeRepository bookChangeRepository;
    private final CrawlStateRepository crawlStateRepository;

    @Override
    public boolean insertBook(Book book) {
        if (bookRepository.existsByUrl(book.getUrl())) {
            log.debug("Book already exists: {}", book.getUrl());
            return false;
        }
        try {
            bookRepository.saveAndFlush(book);
            log.info("Inserted book: {}", book.getTitle());
            return true;
        } catch (DataIntegrityViolationException ex) {
            // a concurrent worker stored the same URL first
            log.debug("Duplicate insert lost the race: {}", book.getUrl());
            return false;
        }
    }

    @Override
    public Optional<Book> findBookByUrl(String url) {
        return bookRepository.findByUrl(url);
    }

    @Override
    public List<Book> listAllBooks() {
        return bookRepository.findAllOrdered();
    }

    @Override
    public long countBooks() {
        return bookRepository.count();
    }

    @Override
    @Transactional
    public Book replaceBook(Book stored, Book fresh) {
        Book target = Optional.ofNullable(stored.getId())
                .flatMap(bookRepository::findById)
                .orElse(stored);
        target.replaceWith(fresh);
        Book saved = bookRepository.save(target);
        if (target != stored) {
            stored.replaceWith(fresh);
        }
        return saved;
    }

    @Override
    public BookChange appendChange(BookChange change) {
        BookChange saved = bookChangeRepository.save(change);
        log.debug("Logged change: {} {}", change.getChangeType().getCode(), change.getBookUrl());
        return saved;
    }

    @Override
    public List<BookChange> listRecentChanges(int limit) {
        return bookChangeRepository.findRecent(PageRequest.of(0, Math.max(limit, 1)));
    }

    @Override
    public Optional<CrawlState> getCrawlState(String stateType) {
        return crawlStateRepository.findByStateType(stateType);
    }

    @Override
    @Transactional
    public CrawlState upsertCrawlState(CrawlState state) {
        CrawlState target = crawlStateRepository.findByStateType(state.getStateType())
                .orElseGet(() -> new CrawlState(state.getStateType(), state.getStartedAt()));
        target.setLastCategory(state.getLastCategory());
        target.setLastPage(state.getLastPage());
        target.setLastBookUrl(state.getLastBookUrl());
        target.setTotalCrawled(state.getTotalCrawled());
        target.setStartedAt(state.getStartedAt());
        target.setUpdatedAt(state.getUpdatedAt());
        target.setStatus(state.getStatus());
        return crawlStateRepository.save(target);
    }

    @Override
    public void deleteCrawlState(String stateType) {
        crawlStateRepository.deleteByStateType(stateType);
    }
}
