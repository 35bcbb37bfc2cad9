package catalogwatch.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * Append-only record of a field-level delta between two snapshots of a book.
 * {@code book} is null for {@link ChangeType#NEW_BOOK} events.
 */
@Entity
@Immutable
@Table(name = "book_change")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
@ToString(exclude = {"book"})
public class BookChange {
    public static final String DETECTED_BY_CRAWLER = "crawler";
    public static final String DETECTED_BY_SCHEDULER = "scheduler";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "book_id")
    private Book book;

    @NotBlank
    @Column(name = "book_url", nullable = false, length = 512)
    private String bookUrl;

    @NotNull
    @Column(name = "change_type", nullable = false, length = 32)
    private ChangeType changeType;

    @Column(name = "old_value", columnDefinition = "TEXT")
    private String oldValue;

    @Column(name = "new_value", columnDefinition = "TEXT")
    private String newValue;

    @NotNull
    @Column(name = "changed_at", nullable = false)
    private LocalDateTime changedAt;

    @Column(name = "detected_by", length = 32)
    private String detectedBy;

    @Builder
    public BookChange(Book book, String bookUrl, ChangeType changeType, String oldValue, String newValue,
                      LocalDateTime changedAt, String detectedBy) {
        this.book = book;
        this.bookUrl = bookUrl;
        this.changeType = changeType;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.changedAt = changedAt != null ? changedAt : LocalDateTime.now();
        this.detectedBy = detectedBy;
    }

    public Long getBookId() {
        return book == null ? null : book.getId();
    }
}
