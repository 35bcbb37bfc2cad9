package catalogwatch.services.impl;

import catalogwatch.exception.FetchException;
import catalogwatch.services.PageLoader;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;

import java.io.IOException;
import java.io.UncheckedIOException;

@Slf4j
public class JsoupPageLoader implements PageLoader {
    private final Connection session;

    public JsoupPageLoader(Connection session) {
        this.session = session;
    }

    @Override
    public String load(String url) throws FetchException {
        try {
            Connection.Response response = session.newRequest()
                    .url(url)
                    .execute();
            int statusCode = response.statusCode();
            if (statusCode < 200 || statusCode >= 300) {
                throw new FetchException(url, statusCode, "HTTP " + statusCode + " for " + url);
            }
            String body = response.body();
            log.debug("Fetched {} ({} chars)", url, body.length());
            return body;
        } catch (FetchException ex) {
            throw ex;
        } catch (IOException | UncheckedIOException | IllegalArgumentException ex) {
            throw new FetchException(url, ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex);
        }
    }
}
