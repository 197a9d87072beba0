package de.mirkosertic.sitesearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.sitesearch.config.ApplicationConfig;
import de.mirkosertic.sitesearch.config.LoggingConfigurator;
import de.mirkosertic.sitesearch.crawler.BrowserFetchStrategy;
import de.mirkosertic.sitesearch.crawler.CrawlExecutorService;
import de.mirkosertic.sitesearch.crawler.CrawlSummary;
import de.mirkosertic.sitesearch.crawler.FetchStrategy;
import de.mirkosertic.sitesearch.crawler.Frontier;
import de.mirkosertic.sitesearch.crawler.HtmlContentExtractor;
import de.mirkosertic.sitesearch.crawler.HttpFetchStrategy;
import de.mirkosertic.sitesearch.crawler.PageFetcher;
import de.mirkosertic.sitesearch.crawler.SeleniumBrowserSession;
import de.mirkosertic.sitesearch.crawler.SiteCrawlerService;
import de.mirkosertic.sitesearch.store.DocumentStore;
import de.mirkosertic.sitesearch.store.InMemoryKeyValueStore;
import de.mirkosertic.sitesearch.store.JedisKeyValueStore;
import de.mirkosertic.sitesearch.store.KeyValueStore;
import de.mirkosertic.sitesearch.web.SiteSearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Main entry point. Wires the crawler, the search service and the HTTP server.
 * <p>
 * Started with the argument {@code crawl} it runs a single crawl invocation and exits
 * instead of serving HTTP.
 */
public class SitesearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(SitesearchApplication.class);

    private final KeyValueStore store;
    private final CrawlExecutorService crawlExecutor;
    private final SiteCrawlerService crawlerService;
    private final SiteSearchHttpServer httpServer;

    public SitesearchApplication(final ApplicationConfig config) {
        final ObjectMapper objectMapper = new ObjectMapper();
        final SiteTextAnalyzer analyzer = new SiteTextAnalyzer();

        // Initialize services in dependency order
        this.store = createStore(config);

        final FetchStrategy browser = config.isBrowserEnabled()
                ? new BrowserFetchStrategy(SeleniumBrowserSession.factory(config))
                : null;
        final FetchStrategy http = new HttpFetchStrategy(
                config.getUserAgent(), config.getAcceptLanguage(), config.getHttpTimeoutMs(), config.getHttpMaxBodyBytes());
        final PageFetcher pageFetcher = new PageFetcher(browser, http, config.getFetchRetries(), config.getRetryBackoff());

        final SnapshotStore snapshotStore = new SnapshotStore(Paths.get(config.getSnapshotPath()), objectMapper);

        this.crawlExecutor = new CrawlExecutorService(config.getThreadPoolSize());

        this.crawlerService = new SiteCrawlerService(
                config.getSeedUrl(),
                config.getBatchSize(),
                new Frontier(store, config.getRevisitWindow(), Clock.systemUTC()),
                pageFetcher,
                new HtmlContentExtractor(config.getMaxContentLength()),
                new DocumentStore(store, objectMapper),
                crawlExecutor,
                snapshotStore,
                analyzer,
                Clock.systemUTC()
        );

        final SiteSearchService searchService = new SiteSearchService(snapshotStore, analyzer, config.getMaxResults());

        this.httpServer = new SiteSearchHttpServer(crawlerService, searchService, objectMapper, config.getServerPort());
    }

    static KeyValueStore createStore(final ApplicationConfig config) {
        if (ApplicationConfig.STORE_TYPE_MEMORY.equalsIgnoreCase(config.getStoreType())) {
            logger.warn("Using the in-memory store, frontier and documents are lost on restart");
            return new InMemoryKeyValueStore();
        }
        if (!ApplicationConfig.STORE_TYPE_REDIS.equalsIgnoreCase(config.getStoreType())) {
            throw new IllegalArgumentException("Unknown store type: " + config.getStoreType());
        }
        return new JedisKeyValueStore(config.getRedisUrl());
    }

    /**
     * Start the HTTP server and block until the process is stopped.
     */
    public void start() throws IOException {
        httpServer.start();

        // Register shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Run one crawl invocation without serving HTTP.
     */
    public CrawlSummary crawlOnce() {
        try {
            return crawlerService.crawl();
        } finally {
            shutdown();
        }
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down site search...");

        // Shutdown in reverse order of initialization
        try {
            httpServer.stop();
        } catch (final Exception e) {
            logger.error("Error stopping HTTP server", e);
        }

        try {
            crawlExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down crawl executor", e);
        }

        try {
            store.close();
        } catch (final Exception e) {
            logger.error("Error closing key-value store", e);
        }

        logger.info("Site search shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equals(System.getProperty("spring.profiles.active"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            final SitesearchApplication app = new SitesearchApplication(config);

            if (args.length > 0 && "crawl".equals(args[0])) {
                final CrawlSummary summary = app.crawlOnce();
                logger.info("{}: {} pages crawled, {} failed, {} skipped, {} documents indexed",
                        summary.message(), summary.pagesCrawled(), summary.failedUrls().size(),
                        summary.skippedUrls().size(), summary.documentsIndexed());
                return;
            }

            app.start();
        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to run site search: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
