package de.mirkosertic.sitesearch.crawler;

import de.mirkosertic.sitesearch.store.InMemoryKeyValueStore;
import de.mirkosertic.sitesearch.store.KeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Frontier Tests")
class FrontierTest {

    private static final String SEED = "https://example.com/";
    private static final Duration REVISIT_WINDOW = Duration.ofHours(6);

    private InMemoryKeyValueStore store;
    private MutableClock clock;
    private Frontier frontier;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        frontier = new Frontier(store, REVISIT_WINDOW, clock);
    }

    @Nested
    @DisplayName("Initialization")
    class InitializationTests {

        @Test
        @DisplayName("Repeated initialization should keep exactly one seed entry")
        void shouldBeIdempotent() {
            frontier.initialize(SEED);
            frontier.initialize(SEED);

            assertThat(store.smembers(Frontier.FRONTIER_KEY)).containsExactly(SEED);
        }

        @Test
        @DisplayName("A frontier key of the wrong type should be replaced by a set")
        void shouldRepairWrongType() {
            // Given
            store.set(Frontier.FRONTIER_KEY, "legacy value");

            // When
            frontier.initialize(SEED);

            // Then
            assertThat(store.type(Frontier.FRONTIER_KEY)).isEqualTo(KeyValueStore.TYPE_SET);
            assertThat(store.smembers(Frontier.FRONTIER_KEY)).containsExactly(SEED);
        }

        @Test
        @DisplayName("Existing frontier entries should survive initialization")
        void shouldKeepExistingEntries() {
            store.sadd(Frontier.FRONTIER_KEY, "https://example.com/a");

            frontier.initialize(SEED);

            assertThat(store.smembers(Frontier.FRONTIER_KEY))
                    .containsExactlyInAnyOrder(SEED, "https://example.com/a");
        }
    }

    @Nested
    @DisplayName("Revisit window")
    class RevisitWindowTests {

        @Test
        @DisplayName("Never visited URLs are always crawlable")
        void shouldAllowUnvisitedUrl() {
            assertThat(frontier.canCrawl(SEED)).isTrue();
        }

        @Test
        @DisplayName("A URL visited within the window must not be crawled again")
        void shouldBlockWithinWindow() {
            frontier.markVisited(SEED);
            clock.advance(REVISIT_WINDOW.minusMillis(1));

            assertThat(frontier.canCrawl(SEED)).isFalse();
        }

        @Test
        @DisplayName("A URL becomes crawlable once exactly one window has passed")
        void shouldAllowAfterWindow() {
            frontier.markVisited(SEED);
            clock.advance(REVISIT_WINDOW);

            assertThat(frontier.canCrawl(SEED)).isTrue();
        }

        @Test
        @DisplayName("markVisited should record the clock time")
        void shouldRecordTimestamp() {
            frontier.markVisited(SEED);

            assertThat(frontier.lastVisited(SEED)).contains(clock.millis());
        }

        @Test
        @DisplayName("A malformed timestamp should be treated as never visited")
        void shouldIgnoreMalformedTimestamp() {
            store.hset(Frontier.VISITED_KEY, SEED, "yesterday");

            assertThat(frontier.lastVisited(SEED)).isEmpty();
            assertThat(frontier.canCrawl(SEED)).isTrue();
        }
    }

    @Nested
    @DisplayName("Batch selection")
    class BatchSelectionTests {

        @Test
        @DisplayName("Never visited URLs come first, then the least recently visited")
        void shouldPreferLeastRecentlyVisited() {
            // Given
            store.sadd(Frontier.FRONTIER_KEY, "https://example.com/old", "https://example.com/recent",
                    "https://example.com/new");
            frontier.markVisited("https://example.com/old");
            clock.advance(Duration.ofMinutes(5));
            frontier.markVisited("https://example.com/recent");

            // When
            final List<String> batch = frontier.selectBatch(10);

            // Then
            assertThat(batch).containsExactly(
                    "https://example.com/new",
                    "https://example.com/old",
                    "https://example.com/recent");
        }

        @Test
        @DisplayName("The batch should be capped at the requested size")
        void shouldCapBatchSize() {
            for (int i = 0; i < 30; i++) {
                store.sadd(Frontier.FRONTIER_KEY, "https://example.com/page" + i);
            }

            assertThat(frontier.selectBatch(20)).hasSize(20).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("An empty frontier yields an empty batch")
        void shouldReturnEmptyBatch() {
            assertThat(frontier.selectBatch(20)).isEmpty();
        }
    }

    @Test
    @DisplayName("Concurrent discovery of the same URL should store it once")
    void shouldDeduplicateConcurrentDiscovery() throws Exception {
        // Given
        final int workers = 8;
        final ExecutorService executor = Executors.newFixedThreadPool(workers);
        final CountDownLatch start = new CountDownLatch(1);
        final List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < workers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    frontier.enqueueDiscovered(List.of("https://example.com/shared", "https://example.com/other"));
                    return null;
                }));
            }
            start.countDown();
            for (final Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(store.smembers(Frontier.FRONTIER_KEY))
                .containsExactlyInAnyOrder("https://example.com/shared", "https://example.com/other");
    }
}
