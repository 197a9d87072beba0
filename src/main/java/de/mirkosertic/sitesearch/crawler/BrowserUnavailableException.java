package de.mirkosertic.sitesearch.crawler;

/**
 * The browser could not be started at all, e.g. a missing or unusable binary or driver.
 * Retrying the browser is pointless; the fetcher degrades to plain HTTP right away.
 */
public class BrowserUnavailableException extends FetchException {

    public BrowserUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
