package catalogwatch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "connection-settings")
public class ConfigConnection {
    private String userAgent = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36";
    private String referer = "https://www.google.com";
    private int timeout = 30000;
}
