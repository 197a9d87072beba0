package de.mirkosertic.sitesearch.crawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.sitesearch.IndexSnapshot;
import de.mirkosertic.sitesearch.IndexingException;
import de.mirkosertic.sitesearch.PageDocument;
import de.mirkosertic.sitesearch.SiteTextAnalyzer;
import de.mirkosertic.sitesearch.SnapshotStore;
import de.mirkosertic.sitesearch.store.DocumentStore;
import de.mirkosertic.sitesearch.store.InMemoryKeyValueStore;
import de.mirkosertic.sitesearch.store.StoreUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openqa.selenium.WebDriverException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("SiteCrawlerService Tests")
class SiteCrawlerServiceTest {

    private static final String SEED = "https://example.com/";
    private static final Duration REVISIT_WINDOW = Duration.ofHours(6);

    @TempDir
    Path tempDir;

    private InMemoryKeyValueStore store;
    private MutableClock clock;
    private Frontier frontier;
    private PageFetcher pageFetcher;
    private SnapshotStore snapshotStore;
    private CrawlExecutorService crawlExecutor;
    private final Map<String, FetchOutcome> pages = new HashMap<>();

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        frontier = new Frontier(store, REVISIT_WINDOW, clock);
        pageFetcher = mock(PageFetcher.class);
        when(pageFetcher.fetch(anyString())).thenAnswer(invocation ->
                pages.getOrDefault(invocation.<String>getArgument(0), new FetchOutcome.Failure("HTTP 404")));
        snapshotStore = new SnapshotStore(tempDir.resolve("snapshot.json"), new ObjectMapper());
        crawlExecutor = new CrawlExecutorService(2);

        pages.put(SEED, new FetchOutcome.Success("""
                <html><head><title>Home</title></head>
                <body><h1>Welcome</h1><a href="/a">Page A</a> <a href="/b">Page B</a></body></html>
                """));
        pages.put("https://example.com/a", new FetchOutcome.Success(
                "<html><head><title>A</title></head><body><p>About engines</p><a href=\"/\">Home</a></body></html>"));
        pages.put("https://example.com/b", new FetchOutcome.Degraded(
                "<html><head><title>B</title></head><body><p>About oil</p></body></html>", "timeout"));
    }

    @AfterEach
    void tearDown() {
        crawlExecutor.shutdown();
    }

    private SiteCrawlerService createService(final InMemoryKeyValueStore keyValueStore, final int batchSize) {
        return new SiteCrawlerService(
                SEED,
                batchSize,
                new Frontier(keyValueStore, REVISIT_WINDOW, clock),
                pageFetcher,
                new HtmlContentExtractor(100_000),
                new DocumentStore(keyValueStore, new ObjectMapper()),
                crawlExecutor,
                snapshotStore,
                new SiteTextAnalyzer(),
                clock);
    }

    @Nested
    @DisplayName("Crawl invocations")
    class CrawlTests {

        @Test
        @DisplayName("First crawl should fetch the seed, enqueue its links and persist the snapshot")
        void shouldCrawlSeed() {
            // When
            final CrawlSummary summary = createService(store, 20).crawl();

            // Then
            assertThat(summary.pagesCrawled()).isEqualTo(1);
            assertThat(summary.crawledUrls()).containsExactly(SEED);
            assertThat(summary.documentsIndexed()).isEqualTo(1);
            assertThat(summary.message()).isEqualTo("Crawl complete");
            assertThat(summary.crawlId()).isNotBlank();

            assertThat(store.smembers(Frontier.FRONTIER_KEY))
                    .containsExactlyInAnyOrder(SEED, "https://example.com/a", "https://example.com/b");
            assertThat(frontier.lastVisited(SEED)).contains(clock.millis());
            assertThat(new DocumentStore(store, new ObjectMapper()).find(PageDocument.idFor(SEED)))
                    .hasValueSatisfying(document -> assertThat(document.links())
                            .isEqualTo("Page A (https://example.com/a), Page B (https://example.com/b)"));

            final IndexSnapshot snapshot = snapshotStore.load();
            assertThat(snapshot.documents()).extracting(PageDocument::url).containsExactly(SEED);
        }

        @Test
        @DisplayName("Second crawl should skip recently visited URLs and merge new pages into the snapshot")
        void shouldMergeSecondCrawl() {
            final SiteCrawlerService service = createService(store, 20);
            service.crawl();

            final CrawlSummary summary = service.crawl();

            assertThat(summary.skippedUrls()).containsExactly(SEED);
            assertThat(summary.crawledUrls()).containsExactlyInAnyOrder("https://example.com/a", "https://example.com/b");
            assertThat(summary.documentsIndexed()).isEqualTo(3);
            assertThat(snapshotStore.load().documents()).hasSize(3);
        }

        @Test
        @DisplayName("Re-crawling after the revisit window should replace documents, not duplicate them")
        void shouldNotDuplicateDocumentsOnRecrawl() {
            final SiteCrawlerService service = createService(store, 20);
            service.crawl();
            service.crawl();

            clock.advance(REVISIT_WINDOW);
            final CrawlSummary summary = service.crawl();

            assertThat(summary.pagesCrawled()).isEqualTo(3);
            assertThat(summary.documentsIndexed()).isEqualTo(3);
        }

        @Test
        @DisplayName("A failed fetch should be marked visited and produce no document")
        void shouldRecordFailedFetch() {
            pages.put(SEED, new FetchOutcome.Failure("HTTP 503"));

            final CrawlSummary summary = createService(store, 20).crawl();

            assertThat(summary.failedUrls()).containsExactly(SEED);
            assertThat(summary.pagesCrawled()).isZero();
            assertThat(summary.documentsIndexed()).isZero();
            assertThat(summary.message()).isEqualTo("Nothing crawled");
            assertThat(frontier.lastVisited(SEED)).isPresent();
            assertThat(Files.exists(snapshotStore.getSnapshotPath())).isFalse();
        }

        @Test
        @DisplayName("An empty batch should be rejected")
        void shouldRejectEmptyBatch() {
            assertThatThrownBy(() -> createService(store, 0).crawl())
                    .isInstanceOf(NoUrlsToCrawlException.class);
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("A store failure inside a crawl task should abort the invocation")
        void shouldAbortOnStoreFailure() {
            final InMemoryKeyValueStore failingStore = new InMemoryKeyValueStore() {
                @Override
                public void hset(final String key, final String field, final String value) {
                    throw new StoreUnavailableException("HSET " + key + " failed: connection refused", null);
                }
            };

            assertThatThrownBy(() -> createService(failingStore, 20).crawl())
                    .isInstanceOf(StoreUnavailableException.class);
            assertThat(Files.exists(snapshotStore.getSnapshotPath())).isFalse();
        }

        @Test
        @DisplayName("A key holding the wrong type should abort the invocation")
        void shouldAbortOnWrongTypeKey() {
            store.set(Frontier.VISITED_KEY, "not a hash");

            assertThatThrownBy(() -> createService(store, 20).crawl())
                    .isInstanceOf(StoreUnavailableException.class)
                    .hasMessageContaining("WRONGTYPE");
        }

        @Test
        @DisplayName("An unexpected error while fetching should still mark the URL visited")
        void shouldMarkVisitedWhenFetchThrows() {
            when(pageFetcher.fetch(SEED)).thenThrow(new IllegalStateException("renderer died"));

            final CrawlSummary summary = createService(store, 20).crawl();

            assertThat(summary.failedUrls()).containsExactly(SEED);
            assertThat(frontier.lastVisited(SEED)).contains(clock.millis());
            assertThat(frontier.canCrawl(SEED)).isFalse();
        }

        @Test
        @DisplayName("A crashing browser should fall back to plain HTTP and still index the page")
        void shouldCrawlThroughFallbackWhenBrowserCrashes() {
            // Given
            final FetchStrategy crashingBrowser = new BrowserFetchStrategy(() -> {
                throw new WebDriverException("chrome crashed after start");
            });
            final FetchStrategy http = new FetchStrategy() {
                @Override
                public String name() {
                    return "http";
                }

                @Override
                public String fetch(final String url) throws FetchException {
                    return pages.get(url).html().orElseThrow(() -> new FetchException("HTTP 404 for " + url));
                }
            };
            pageFetcher = new PageFetcher(crashingBrowser, http, 2, Duration.ZERO);

            // When
            final CrawlSummary summary = createService(store, 20).crawl();

            // Then
            assertThat(summary.crawledUrls()).containsExactly(SEED);
            assertThat(summary.documentsIndexed()).isEqualTo(1);
            assertThat(frontier.lastVisited(SEED)).isPresent();
        }

        @Test
        @DisplayName("An unreadable snapshot should abort indexing and keep the existing file")
        void shouldNotOverwriteUnreadableSnapshot() throws IOException {
            // Given
            final String corrupted = """
                    {"fields": ["title", "content", "description", "links"], "documents": [
                      {"id": "1", "title": "Old A", "description": "a", "content": "a", "url": "https://example.com/old-a", "links": "", "lastCrawled": 1},
                      {"id": "2", "title": "Old B", "description": null, "content": "b", "url": "https://example.com/old-b", "links": "", "lastCrawled": 1},
                      {"id": "3", "title": "Old C", "description": "c", "content": "c", "url": "https://example.com/old-c", "links": "", "lastCrawled": 1}
                    ]}
                    """;
            Files.writeString(snapshotStore.getSnapshotPath(), corrupted);

            // When / Then
            assertThatThrownBy(() -> createService(store, 20).crawl())
                    .isInstanceOf(IndexingException.class);
            assertThat(Files.readString(snapshotStore.getSnapshotPath())).isEqualTo(corrupted);
        }

        @Test
        @DisplayName("Only one crawl may run at a time")
        void shouldRejectConcurrentCrawl() throws Exception {
            // Given
            final CountDownLatch fetching = new CountDownLatch(1);
            final CountDownLatch release = new CountDownLatch(1);
            when(pageFetcher.fetch(SEED)).thenAnswer(invocation -> {
                fetching.countDown();
                release.await(10, TimeUnit.SECONDS);
                return pages.get(SEED);
            });
            final SiteCrawlerService service = createService(store, 20);

            // When
            final CompletableFuture<CrawlSummary> first = CompletableFuture.supplyAsync(service::crawl);
            assertThat(fetching.await(10, TimeUnit.SECONDS)).isTrue();

            // Then
            try {
                assertThat(service.isCrawling()).isTrue();
                assertThatThrownBy(service::crawl).isInstanceOf(CrawlInProgressException.class);
            } finally {
                release.countDown();
            }
            assertThat(first.get(10, TimeUnit.SECONDS).pagesCrawled()).isEqualTo(1);
            assertThat(service.isCrawling()).isFalse();
        }
    }
}
