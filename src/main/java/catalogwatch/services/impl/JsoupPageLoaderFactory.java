package catalogwatch.services.impl;

import catalogwatch.config.ConfigConnection;
import catalogwatch.services.PageLoader;
import catalogwatch.services.PageLoaderFactory;
import lombok.RequiredArgsConstructor;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JsoupPageLoaderFactory implements PageLoaderFactory {
    private final ConfigConnection configConnection;

    @Override
    public PageLoader openSession() {
        Connection session = Jsoup.newSession()
                .userAgent(configConnection.getUserAgent())
                .referrer(configConnection.getReferer())
                .timeout(configConnection.getTimeout())
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .maxBodySize(0);
        return new JsoupPageLoader(session);
    }
}
