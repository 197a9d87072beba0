package de.mirkosertic.sitesearch.store;

/**
 * Raised when the key-value store cannot serve a request. Fatal to the running crawl.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(final String message) {
        super(message);
    }

    public StoreUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
