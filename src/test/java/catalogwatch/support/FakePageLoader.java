package catalogwatch.support;

import catalogwatch.exception.FetchException;
import catalogwatch.services.PageLoader;
import catalogwatch.services.PageLoaderFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves canned markup by URL; unknown URLs answer 404. A URL can be made to fail a number of
 * times before it starts answering.
 */
public class FakePageLoader implements PageLoader, PageLoaderFactory {
    private final Map<String, String> pages = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> failuresLeft = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    public FakePageLoader page(String url, String html) {
        pages.put(url, html);
        return this;
    }

    public FakePageLoader failing(String url, int times) {
        failuresLeft.put(url, new AtomicInteger(times));
        return this;
    }

    public void remove(String url) {
        pages.remove(url);
    }

    public int calls(String url) {
        AtomicInteger count = calls.get(url);
        return count == null ? 0 : count.get();
    }

    @Override
    public String load(String url) throws FetchException {
        calls.computeIfAbsent(url, key -> new AtomicInteger()).incrementAndGet();
        AtomicInteger failures = failuresLeft.get(url);
        if (failures != null && failures.getAndDecrement() > 0) {
            throw new FetchException(url, 503, "HTTP 503 for " + url);
        }
        String html = pages.get(url);
        if (html == null) {
            throw new FetchException(url, 404, "HTTP 404 for " + url);
        }
        return html;
    }

    @Override
    public PageLoader openSession() {
        return this;
    }
}
