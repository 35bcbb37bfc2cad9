package catalogwatch.services;

/**
 * Opens the HTTP session shared by all requests of one crawl or detection run.
 */
public interface PageLoaderFactory {
    PageLoader openSession();
}
