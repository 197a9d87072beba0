package de.mirkosertic.sitesearch;

/**
 * The index snapshot could not be built or written.
 */
public class IndexingException extends RuntimeException {

    public IndexingException(final String message) {
        super(message);
    }

    public IndexingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
