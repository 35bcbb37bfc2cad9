package catalogwatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "catalog.reports")
@Data
public class ReportSettings {
    private String directory = "reports";
    private int limit = 100;
}
