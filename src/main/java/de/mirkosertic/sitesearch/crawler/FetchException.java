package de.mirkosertic.sitesearch.crawler;

/**
 * A single fetch attempt failed: network error, timeout, render error, HTTP error status,
 * or a response that is not an HTML page.
 */
public class FetchException extends Exception {

    public FetchException(final String message) {
        super(message);
    }

    public FetchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
