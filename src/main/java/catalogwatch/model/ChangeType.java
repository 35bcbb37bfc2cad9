package catalogwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ChangeType {
    NEW_BOOK("new_book"),
    PRICE_CHANGE("price_change"),
    AVAILABILITY_CHANGE("availability_change"),
    RATING_CHANGE("rating_change"),
    REVIEWS_CHANGE("reviews_change");

    private final String code;

    ChangeType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ChangeType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown change type: " + code));
    }
}
