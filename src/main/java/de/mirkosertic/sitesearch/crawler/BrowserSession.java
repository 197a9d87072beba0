package de.mirkosertic.sitesearch.crawler;

/**
 * An isolated browser instance owned by exactly one fetch attempt.
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * Load the page, failing if it does not finish loading within the page-load timeout.
     */
    void navigate(String url) throws FetchException;

    /**
     * Wait until the page stops issuing network requests. Returns once the network has
     * been quiet or the idle timeout has passed, whichever comes first.
     */
    void awaitNetworkIdle() throws FetchException;

    /**
     * The rendered HTML of the current page.
     */
    String pageSource() throws FetchException;

    @Override
    void close();
}
