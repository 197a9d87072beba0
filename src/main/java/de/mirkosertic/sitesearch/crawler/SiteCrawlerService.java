package de.mirkosertic.sitesearch.crawler;

import de.mirkosertic.sitesearch.IndexingException;
import de.mirkosertic.sitesearch.PageDocument;
import de.mirkosertic.sitesearch.SiteIndexBuilder;
import de.mirkosertic.sitesearch.SnapshotStore;
import de.mirkosertic.sitesearch.store.DocumentStore;
import de.mirkosertic.sitesearch.store.StoreUnavailableException;
import de.mirkosertic.sitesearch.util.Urls;
import org.apache.lucene.analysis.Analyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one crawl invocation: pick a batch from the frontier, fetch and store every eligible
 * page in parallel, then merge the new documents into the index snapshot.
 * <p>
 * Crawl tasks are independent of each other. A failing page only fails its own task, while
 * an unreachable key-value store aborts the whole invocation.
 */
public class SiteCrawlerService {

    private static final Logger logger = LoggerFactory.getLogger(SiteCrawlerService.class);

    private final String seedUrl;
    private final int batchSize;
    private final Frontier frontier;
    private final PageFetcher pageFetcher;
    private final HtmlContentExtractor contentExtractor;
    private final DocumentStore documentStore;
    private final CrawlExecutorService crawlExecutor;
    private final SnapshotStore snapshotStore;
    private final Analyzer analyzer;
    private final Clock clock;

    private final AtomicBoolean crawling = new AtomicBoolean(false);

    public SiteCrawlerService(
            final String seedUrl,
            final int batchSize,
            final Frontier frontier,
            final PageFetcher pageFetcher,
            final HtmlContentExtractor contentExtractor,
            final DocumentStore documentStore,
            final CrawlExecutorService crawlExecutor,
            final SnapshotStore snapshotStore,
            final Analyzer analyzer,
            final Clock clock) {
        this.seedUrl = Urls.canonicalize(seedUrl)
                .orElseThrow(() -> new IllegalArgumentException("Seed URL is not an absolute http(s) URL: " + seedUrl));
        this.batchSize = batchSize;
        this.frontier = frontier;
        this.pageFetcher = pageFetcher;
        this.contentExtractor = contentExtractor;
        this.documentStore = documentStore;
        this.crawlExecutor = crawlExecutor;
        this.snapshotStore = snapshotStore;
        this.analyzer = analyzer;
        this.clock = clock;
    }

    public boolean isCrawling() {
        return crawling.get();
    }

    /**
     * @throws CrawlInProgressException  if another crawl is running
     * @throws NoUrlsToCrawlException    if the frontier yields no URLs
     * @throws StoreUnavailableException if the key-value store fails during the crawl
     * @throws IndexingException         if the existing snapshot cannot be read or the new one cannot be written
     */
    public CrawlSummary crawl() {
        if (!crawling.compareAndSet(false, true)) {
            throw new CrawlInProgressException("A crawl is already running");
        }
        try {
            return runCrawl(UUID.randomUUID().toString());
        } finally {
            crawling.set(false);
        }
    }

    private CrawlSummary runCrawl(final String crawlId) {
        final long startTime = System.currentTimeMillis();
        logger.info("Starting crawl {} from {}", crawlId, seedUrl);

        frontier.initialize(seedUrl);
        final List<String> batch = frontier.selectBatch(batchSize);
        if (batch.isEmpty()) {
            throw new NoUrlsToCrawlException("No URLs to crawl");
        }
        logger.info("Crawl {} selected {} URLs", crawlId, batch.size());

        final Map<String, Future<PageResult>> tasks = new LinkedHashMap<>();
        for (final String url : batch) {
            tasks.put(url, crawlExecutor.submit(() -> crawlPage(url)));
        }
        final List<PageResult> results = collect(tasks);

        final List<String> crawledUrls = new ArrayList<>();
        final List<String> failedUrls = new ArrayList<>();
        final List<String> skippedUrls = new ArrayList<>();
        final List<PageDocument> documents = new ArrayList<>();
        for (final PageResult result : results) {
            switch (result.status()) {
                case CRAWLED -> {
                    crawledUrls.add(result.url());
                    documents.add(result.document());
                }
                case FAILED -> failedUrls.add(result.url());
                case SKIPPED -> skippedUrls.add(result.url());
            }
        }

        final int documentsIndexed;
        final String message;
        if (documents.isEmpty()) {
            logger.info("Crawl {} fetched no pages, index snapshot left unchanged", crawlId);
            documentsIndexed = 0;
            message = "Nothing crawled";
        } else {
            documentsIndexed = index(documents);
            message = "Crawl complete";
        }

        final long elapsedMs = System.currentTimeMillis() - startTime;
        logger.info("Crawl {} finished in {}ms: {} crawled, {} failed, {} skipped, {} documents indexed",
                crawlId, elapsedMs, crawledUrls.size(), failedUrls.size(), skippedUrls.size(), documentsIndexed);
        return new CrawlSummary(crawlId, crawledUrls.size(), crawledUrls, failedUrls, skippedUrls,
                documentsIndexed, elapsedMs, message);
    }

    /**
     * Process a single URL. Runs on a crawler thread.
     */
    PageResult crawlPage(final String url) {
        if (!frontier.canCrawl(url)) {
            logger.debug("Skipping {}, visited within the revisit window", url);
            return PageResult.skipped(url);
        }

        final FetchOutcome outcome;
        try {
            outcome = pageFetcher.fetch(url);
        } finally {
            frontier.markVisited(url);
        }

        if (outcome instanceof FetchOutcome.Failure failure) {
            logger.warn("Failed to fetch {}: {}", url, failure.reason());
            return PageResult.failed(url, failure.reason());
        }
        if (outcome instanceof FetchOutcome.Degraded degraded) {
            logger.info("Fetched {} without rendering ({})", url, degraded.primaryFailure());
        }

        final String html = outcome.html().orElse("");
        final ExtractedPage page = contentExtractor.extract(url, html);
        final PageDocument document = new PageDocument(
                PageDocument.idFor(url),
                page.title(),
                page.description(),
                page.content(),
                url,
                page.serializedLinks(),
                clock.millis());
        documentStore.save(document);
        frontier.enqueueDiscovered(page.links());

        logger.debug("Crawled {} ({} links)", url, page.links().size());
        return PageResult.crawled(url, document);
    }

    private List<PageResult> collect(final Map<String, Future<PageResult>> tasks) {
        final List<PageResult> results = new ArrayList<>(tasks.size());
        for (final Map.Entry<String, Future<PageResult>> task : tasks.entrySet()) {
            try {
                results.add(task.getValue().get());
            } catch (final ExecutionException e) {
                final Throwable cause = e.getCause();
                if (cause instanceof StoreUnavailableException storeUnavailable) {
                    cancelAll(tasks);
                    throw storeUnavailable;
                }
                logger.error("Crawl task for {} failed", task.getKey(), cause);
                results.add(PageResult.failed(task.getKey(), String.valueOf(cause)));
            } catch (final InterruptedException e) {
                cancelAll(tasks);
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for crawl tasks", e);
            }
        }
        return results;
    }

    private static void cancelAll(final Map<String, Future<PageResult>> tasks) {
        for (final Future<PageResult> future : tasks.values()) {
            future.cancel(true);
        }
    }

    private int index(final List<PageDocument> documents) {
        try (final SiteIndexBuilder builder = new SiteIndexBuilder(snapshotStore, analyzer)) {
            builder.seed(snapshotStore.loadForUpdate());
            builder.addAll(documents);
            return builder.persist().documents().size();
        } catch (final IOException | IllegalArgumentException e) {
            throw new IndexingException("Failed to build index snapshot: " + e.getMessage(), e);
        }
    }
}
