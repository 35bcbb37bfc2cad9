package catalogwatch.services.impl;

import catalogwatch.config.RetryPolicy;
import catalogwatch.dto.fetch.FetchedPage;
import catalogwatch.exception.FetchException;
import catalogwatch.services.PageLoader;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retrying GET on top of a {@link PageLoader}. Waits {@code initialDelay}, then
 * {@code initialDelay * backoffFactor}, ... between attempts.
 */
@Slf4j
public class PageFetcher {
    private final PageLoader pageLoader;
    private final RetryPolicy retryPolicy;
    private final Retry retry;

    public PageFetcher(PageLoader pageLoader, RetryPolicy retryPolicy) {
        this.pageLoader = pageLoader;
        this.retryPolicy = retryPolicy;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retryPolicy.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        retryPolicy.initialDelay(), retryPolicy.backoffFactor()))
                .retryExceptions(IOException.class)
                .build();
        this.retry = Retry.of("page-fetch", config);
    }

    public FetchedPage fetch(String url) throws FetchException {
        AtomicInteger attempts = new AtomicInteger();
        try {
            String html = retry.executeCheckedSupplier(() -> {
                int attempt = attempts.incrementAndGet();
                try {
                    return pageLoader.load(url);
                } catch (FetchException ex) {
                    if (attempt < retryPolicy.maxAttempts()) {
                        log.warn("Attempt {}/{} failed for {}: {}", attempt, retryPolicy.maxAttempts(), url, ex.getMessage());
                    }
                    throw ex;
                }
            });
            return new FetchedPage(url, html, attempts.get());
        } catch (FetchException ex) {
            log.error("All {} attempts failed for {}: {}", attempts.get(), url, ex.getMessage());
            throw new FetchException(ex, attempts.get());
        } catch (RuntimeException | Error ex) {
            throw ex;
        } catch (Throwable ex) {
            throw new FetchException(url, "Unexpected failure fetching " + url, ex);
        }
    }

    /**
     * Markup of {@code url}, or null when it stays unavailable after every attempt.
     */
    public String fetchOrNull(String url) {
        try {
            return fetch(url).html();
        } catch (FetchException ex) {
            return null;
        }
    }
}
