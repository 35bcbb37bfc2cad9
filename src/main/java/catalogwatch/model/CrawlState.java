package catalogwatch.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Durable resume marker. One row per crawl type, upserted after every page and removed
 * once a crawl finishes all categories.
 */
@Entity
@Table(name = "crawl_state")
@NoArgsConstructor
@Getter
@Setter
@ToString
public class CrawlState {
    public static final String DEFAULT_TYPE = "crawler";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "state_type", nullable = false, unique = true, length = 64)
    private String stateType = DEFAULT_TYPE;

    @Column(name = "last_category")
    private String lastCategory;

    @NotNull
    @Column(name = "last_page", nullable = false)
    private Integer lastPage = 1;

    @Column(name = "last_book_url", length = 512)
    private String lastBookUrl;

    @NotNull
    @Column(name = "total_crawled", nullable = false)
    private Integer totalCrawled = 0;

    @NotNull
    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @NotNull
    @Column(nullable = false, length = 32)
    private CrawlStatus status = CrawlStatus.IN_PROGRESS;

    public CrawlState(String stateType, LocalDateTime startedAt) {
        this.stateType = stateType;
        this.startedAt = startedAt;
        this.updatedAt = startedAt;
    }

    public void recordProgress(String category, String lastBookUrl, int page, int totalCrawled) {
        this.lastCategory = category;
        this.lastBookUrl = lastBookUrl;
        this.lastPage = page;
        this.totalCrawled = totalCrawled;
        this.updatedAt = LocalDateTime.now();
    }

    @PrePersist
    @PreUpdate
    protected void onSave() {
        LocalDateTime now = LocalDateTime.now();
        if (startedAt == null) {
            startedAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
}
