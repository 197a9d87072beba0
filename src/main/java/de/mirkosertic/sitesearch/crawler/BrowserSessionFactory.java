package de.mirkosertic.sitesearch.crawler;

@FunctionalInterface
public interface BrowserSessionFactory {

    /**
     * @throws BrowserUnavailableException if no browser can be started
     */
    BrowserSession open() throws BrowserUnavailableException;
}
