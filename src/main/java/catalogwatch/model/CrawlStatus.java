package catalogwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum CrawlStatus {
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");

    private final String code;

    CrawlStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static CrawlStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown crawl status: " + code));
    }
}
