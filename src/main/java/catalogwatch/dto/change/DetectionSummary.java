package catalogwatch.dto.change;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Counters of one change detection cycle. The cycle is sequential, so plain fields suffice.
 */
@Data
public class DetectionSummary {
    private LocalDateTime startedAt = LocalDateTime.now();
    private LocalDateTime finishedAt;
    private int checked;
    private int unchanged;
    private int updated;
    private int skipped;
    private int priceChanges;
    private int availabilityChanges;
    private int ratingChanges;
    private int reviewsChanges;

    public int getTotalChanges() {
        return priceChanges + availabilityChanges + ratingChanges + reviewsChanges;
    }

    public boolean hasChanges() {
        return getTotalChanges() > 0;
    }
}
