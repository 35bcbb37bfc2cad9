package catalogwatch.dto.change;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record ChangeReport(@JsonProperty("generated_at")
                           @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
                           LocalDateTime generatedAt,
                           @JsonProperty("total_changes") int totalChanges,
                           @JsonProperty("changes") List<ChangeEntry> changes) {
}
