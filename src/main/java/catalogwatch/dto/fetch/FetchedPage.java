package catalogwatch.dto.fetch;

public record FetchedPage(String url, String html, int attempts) {
}
