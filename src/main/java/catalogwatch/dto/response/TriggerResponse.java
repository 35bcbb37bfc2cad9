package catalogwatch.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TriggerResponse {
    private final boolean result;
    private final String message;

    public static TriggerResponse started(String message) {
        return new TriggerResponse(true, message);
    }

    public static TriggerResponse rejected(String message) {
        return new TriggerResponse(false, message);
    }
}
