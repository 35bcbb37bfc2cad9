package catalogwatch.model;

import catalogwatch.util.ContentHasher;
import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "book", uniqueConstraints = {@UniqueConstraint(name = "uk_book_url", columnNames = {"url"})})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(of = {"url"})
@ToString(exclude = {"description", "rawHtml"})
public class Book {
    public static final String STATUS_ACTIVE = "active";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(nullable = false, length = 512)
    private String url;

    @NotBlank
    @Column(nullable = false, length = 512)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @NotBlank
    @Column(nullable = false)
    private String category;

    @NotNull
    @DecimalMin(value = "0.00", inclusive = false)
    @Digits(integer = 8, fraction = 2)
    @Column(name = "price_excl_tax", nullable = false, precision = 10, scale = 2)
    private BigDecimal priceExclTax;

    @NotNull
    @DecimalMin(value = "0.00", inclusive = false)
    @Digits(integer = 8, fraction = 2)
    @Column(name = "price_incl_tax", nullable = false, precision = 10, scale = 2)
    private BigDecimal priceInclTax;

    @NotNull
    @Column(nullable = false)
    private String availability;

    @NotNull
    @PositiveOrZero
    @Column(name = "num_reviews", nullable = false)
    private Integer numReviews;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @NotNull
    @Min(1)
    @Max(5)
    @Column(nullable = false)
    private Integer rating;

    @NotNull
    @Column(name = "crawl_timestamp", nullable = false)
    private LocalDateTime crawlTimestamp;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @NotBlank
    @Column(nullable = false, length = 32)
    private String status = STATUS_ACTIVE;

    @Lob
    @Column(name = "raw_html", columnDefinition = "LONGTEXT")
    private String rawHtml;

    public Book(String url, String title, String category, BigDecimal priceExclTax, BigDecimal priceInclTax,
                String availability, Integer numReviews, String imageUrl, Integer rating) {
        this.url = url;
        this.title = title;
        this.category = category;
        this.priceExclTax = priceExclTax;
        this.priceInclTax = priceInclTax;
        this.availability = availability;
        this.numReviews = numReviews;
        this.imageUrl = imageUrl;
        this.rating = rating;
        this.crawlTimestamp = LocalDateTime.now();
        refreshContentHash();
    }

    public String computeContentHash() {
        return ContentHasher.contentHash(title, priceExclTax, priceInclTax, availability, numReviews, rating);
    }

    public String refreshContentHash() {
        this.contentHash = computeContentHash();
        return contentHash;
    }

    /**
     * Copies every mutable field of {@code fresh} onto this book. The id and url stay untouched.
     */
    public void replaceWith(Book fresh) {
        this.title = fresh.title;
        this.description = fresh.description;
        this.category = fresh.category;
        this.priceExclTax = fresh.priceExclTax;
        this.priceInclTax = fresh.priceInclTax;
        this.availability = fresh.availability;
        this.numReviews = fresh.numReviews;
        this.imageUrl = fresh.imageUrl;
        this.rating = fresh.rating;
        this.status = fresh.status;
        this.rawHtml = fresh.rawHtml;
        this.crawlTimestamp = LocalDateTime.now();
        refreshContentHash();
    }

    @PrePersist
    @PreUpdate
    protected void onSave() {
        if (crawlTimestamp == null) {
            crawlTimestamp = LocalDateTime.now();
        }
        refreshContentHash();
    }
}
