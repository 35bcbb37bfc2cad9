package catalogwatch.config;

import catalogwatch.services.impl.BookParser;
import catalogwatch.util.UrlResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ParserConfig {

    @Bean
    public UrlResolver urlResolver(CrawlerSettings crawlerSettings) {
        return new UrlResolver(crawlerSettings.getBaseUrl(), crawlerSettings.getCatalogueDir());
    }

    @Bean
    public BookParser bookParser(UrlResolver urlResolver) {
        return new BookParser(urlResolver);
    }
}
