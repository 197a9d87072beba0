package de.mirkosertic.sitesearch.crawler;

public class NoUrlsToCrawlException extends RuntimeException {

    public NoUrlsToCrawlException(final String message) {
        super(message);
    }
}
