package catalogwatch.util;

import lombok.Getter;

/**
 * Turns the relative links found on catalogue pages into absolute URLs.
 * <p>
 * Links climbing out of the current directory ({@code ../../foo/index.html}) always point into the
 * catalogue directory, so every {@code ../} is dropped and the catalogue prefix put back in front.
 */
@Getter
public class UrlResolver {
    private final String baseUrl;
    private final String catalogueDir;

    public UrlResolver(String baseUrl, String catalogueDir) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.catalogueDir = catalogueDir;
    }

    public String buildAbsoluteUrl(String relativeUrl) {
        return buildAbsoluteUrl(baseUrl, relativeUrl, catalogueDir);
    }

    public static String buildAbsoluteUrl(String baseUrl, String relativeUrl, String catalogueDir) {
        if (relativeUrl == null || relativeUrl.isBlank()) {
            return stripTrailingSlash(baseUrl);
        }
        String path = relativeUrl.trim();
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        if (path.contains("../")) {
            path = path.replace("../", "");
            String prefix = catalogueDir + "/";
            if (!path.startsWith(prefix)) {
                path = prefix + path;
            }
        }
        return stripTrailingSlash(baseUrl) + "/" + path;
    }

    /**
     * Replaces the last path segment of {@code currentUrl}, the way a browser follows "page-2.html".
     */
    public static String resolveSibling(String currentUrl, String relativeUrl) {
        int slash = currentUrl.lastIndexOf('/');
        String directory = slash >= 0 ? currentUrl.substring(0, slash + 1) : currentUrl + "/";
        return directory + relativeUrl;
    }

    /**
     * Address of page {@code page} of a category whose first page is {@code categoryUrl}.
     */
    public static String pageUrl(String categoryUrl, int page) {
        if (page <= 1) {
            return categoryUrl;
        }
        return resolveSibling(categoryUrl, "page-" + page + ".html");
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
