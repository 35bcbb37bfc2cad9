package catalogwatch.services;

import catalogwatch.exception.FetchException;

/**
 * One HTTP GET, no retries. Non-2xx answers and transport errors surface as {@link FetchException}.
 */
public interface PageLoader {
    String load(String url) throws FetchException;
}
