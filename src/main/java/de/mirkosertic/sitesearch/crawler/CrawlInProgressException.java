package de.mirkosertic.sitesearch.crawler;

/**
 * A crawl was triggered while another one is still running.
 */
public class CrawlInProgressException extends RuntimeException {

    public CrawlInProgressException(final String message) {
        super(message);
    }
}
