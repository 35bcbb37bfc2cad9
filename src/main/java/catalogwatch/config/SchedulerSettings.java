package catalogwatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "catalog.scheduler")
@Data
public class SchedulerSettings {
    private boolean enabled = false;
    private LocalTime runTime = LocalTime.of(2, 0);
    private ZoneId timezone = ZoneId.of("UTC");
}
