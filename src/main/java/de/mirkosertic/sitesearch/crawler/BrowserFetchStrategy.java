package de.mirkosertic.sitesearch.crawler;

/**
 * Renders a page in a fresh browser session and returns the resulting DOM as HTML.
 * The session is closed after every attempt, successful or not.
 */
public class BrowserFetchStrategy implements FetchStrategy {

    private final BrowserSessionFactory sessionFactory;

    public BrowserFetchStrategy(final BrowserSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public String name() {
        return "browser";
    }

    @Override
    public String fetch(final String url) throws FetchException {
        try (final BrowserSession session = sessionFactory.open()) {
            session.navigate(url);
            session.awaitNetworkIdle();
            return session.pageSource();
        }
    }
}
