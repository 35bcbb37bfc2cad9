package catalogwatch.exception;

import lombok.Getter;

import java.io.IOException;

@Getter
public class FetchException extends IOException {
    private final String url;
    private final int statusCode;
    private final int attempts;

    public FetchException(String url, int statusCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
        this.attempts = 1;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = -1;
        this.attempts = 1;
    }

    public FetchException(FetchException last, int attempts) {
        super("Unavailable after " + attempts + " attempt(s): " + last.getMessage(), last);
        this.url = last.url;
        this.statusCode = last.statusCode;
        this.attempts = attempts;
    }
}
