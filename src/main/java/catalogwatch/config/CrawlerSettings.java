package catalogwatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "catalog.crawler")
@Data
public class CrawlerSettings {

    private String baseUrl = "https://books.toscrape.com";
    private String catalogueDir = "catalogue";
    private int concurrency = 10;
    private boolean recordNewBooks = true;
    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(2);
        private double backoffFactor = 2.0;
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialDelay(), retry.getBackoffFactor());
    }
}
