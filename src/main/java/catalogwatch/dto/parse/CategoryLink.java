package catalogwatch.dto.parse;

public record CategoryLink(String name, String url) {
}
