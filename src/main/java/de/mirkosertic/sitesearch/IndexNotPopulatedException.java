package de.mirkosertic.sitesearch;

/**
 * Raised when a search runs before any crawl has produced a snapshot with documents.
 * Distinct from a search that simply has no matches.
 */
public class IndexNotPopulatedException extends RuntimeException {

    public IndexNotPopulatedException(final String message) {
        super(message);
    }
}
