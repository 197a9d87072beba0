package de.mirkosertic.sitesearch.crawler;

/**
 * One way of acquiring the HTML of a page.
 */
public interface FetchStrategy {

    /**
     * Short name used in log messages.
     */
    String name();

    /**
     * @return the HTML of the page, never null
     * @throws FetchException if this attempt did not produce a page
     */
    String fetch(String url) throws FetchException;
}
