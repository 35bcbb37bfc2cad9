package catalogwatch.exception;

public class CrawlAbortedException extends RuntimeException {
    public CrawlAbortedException(String message) {
        super(message);
    }

    public CrawlAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
