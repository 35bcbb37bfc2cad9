package catalogwatch.dto.change;

import catalogwatch.model.BookChange;
import catalogwatch.model.ChangeType;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record ChangeEntry(@JsonProperty("change_type") ChangeType changeType,
                          @JsonProperty("book_id") Long bookId,
                          @JsonProperty("book_url") String bookUrl,
                          @JsonProperty("old_value") String oldValue,
                          @JsonProperty("new_value") String newValue,
                          @JsonProperty("changed_at")
                          @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
                          LocalDateTime changedAt) {

    public static ChangeEntry of(BookChange change) {
        return new ChangeEntry(change.getChangeType(), change.getBookId(), change.getBookUrl(),
                change.getOldValue(), change.getNewValue(), change.getChangedAt());
    }
}
