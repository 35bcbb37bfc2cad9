package catalogwatch.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class BookValidationException extends RuntimeException {
    private final String url;
    private final List<String> violations;

    public BookValidationException(String url, List<String> violations) {
        super("Invalid book " + url + ": " + String.join("; ", violations));
        this.url = url;
        this.violations = List.copyOf(violations);
    }
}
