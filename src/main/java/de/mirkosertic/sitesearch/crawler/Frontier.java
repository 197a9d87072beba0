package de.mirkosertic.sitesearch.crawler;

import de.mirkosertic.sitesearch.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * URL discovery, deduplication and revisit throttling for the crawled site.
 * <p>
 * The frontier is a set in the key-value store ({@value #FRONTIER_KEY}); visit timestamps
 * live in a separate hash ({@value #VISITED_KEY}) mapping URL to epoch millis. URLs are never
 * removed from the frontier; they become eligible again once the revisit window has elapsed.
 */
public class Frontier {

    private static final Logger logger = LoggerFactory.getLogger(Frontier.class);

    static final String FRONTIER_KEY = "urls:to_crawl";
    static final String VISITED_KEY = "urls:visited";

    private final KeyValueStore store;
    private final Duration revisitWindow;
    private final Clock clock;

    public Frontier(final KeyValueStore store, final Duration revisitWindow, final Clock clock) {
        this.store = store;
        this.revisitWindow = revisitWindow;
        this.clock = clock;
    }

    /**
     * Make sure the frontier set exists and contains the seed URL. Safe to call on every crawl.
     * A frontier key holding another type is deleted first.
     */
    public void initialize(final String seedUrl) {
        final String type = store.type(FRONTIER_KEY);
        if (!KeyValueStore.TYPE_SET.equals(type) && !KeyValueStore.TYPE_NONE.equals(type)) {
            logger.warn("Resetting {} because it holds a {} instead of a set", FRONTIER_KEY, type);
            store.del(FRONTIER_KEY);
        }
        if (store.sadd(FRONTIER_KEY, seedUrl) > 0) {
            logger.info("Initialized {} with seed URL {}", FRONTIER_KEY, seedUrl);
        } else {
            logger.debug("Seed URL already in {}: {}", FRONTIER_KEY, seedUrl);
        }
    }

    /**
     * Up to {@code maxSize} frontier URLs. Never visited URLs come first, then the ones
     * visited longest ago, so every URL eventually gets a slot. Revisit eligibility is not
     * checked here, see {@link #canCrawl(String)}.
     */
    public List<String> selectBatch(final int maxSize) {
        final Set<String> members = store.smembers(FRONTIER_KEY);
        final List<Candidate> candidates = new ArrayList<>(members.size());
        for (final String url : members) {
            candidates.add(new Candidate(url, lastVisited(url).orElse(Long.MIN_VALUE)));
        }
        candidates.sort(Comparator.comparingLong(Candidate::lastVisited).thenComparing(Candidate::url));

        final List<String> batch = new ArrayList<>(Math.min(maxSize, candidates.size()));
        for (final Candidate candidate : candidates) {
            if (batch.size() >= maxSize) {
                break;
            }
            batch.add(candidate.url());
        }
        logger.debug("Selected {} of {} frontier URLs", batch.size(), members.size());
        return batch;
    }

    /**
     * True if the URL was never visited or its last visit is at least one revisit window ago.
     */
    public boolean canCrawl(final String url) {
        final Optional<Long> lastVisited = lastVisited(url);
        if (lastVisited.isEmpty()) {
            return true;
        }
        return clock.millis() - lastVisited.get() >= revisitWindow.toMillis();
    }

    /**
     * Record a crawl attempt. Called for failed fetches too.
     */
    public void markVisited(final String url) {
        store.hset(VISITED_KEY, url, Long.toString(clock.millis()));
    }

    public void enqueueDiscovered(final Collection<String> urls) {
        if (urls.isEmpty()) {
            return;
        }
        final long added = store.sadd(FRONTIER_KEY, urls.toArray(new String[0]));
        if (added > 0) {
            logger.debug("Added {} new URLs to the frontier", added);
        }
    }

    public Optional<Long> lastVisited(final String url) {
        final String timestamp = store.hget(VISITED_KEY, url);
        if (timestamp == null || timestamp.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(timestamp.trim()));
        } catch (final NumberFormatException e) {
            logger.warn("Ignoring malformed visit timestamp for {}: {}", url, timestamp);
            return Optional.empty();
        }
    }

    private record Candidate(String url, long lastVisited) {
    }
}
