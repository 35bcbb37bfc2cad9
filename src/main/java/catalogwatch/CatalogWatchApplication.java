package catalogwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CatalogWatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(CatalogWatchApplication.class, args);
    }
}
