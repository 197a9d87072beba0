package de.mirkosertic.sitesearch.crawler;

import java.util.Optional;

/**
 * Result of {@link PageFetcher#fetch(String)}.
 */
public sealed interface FetchOutcome {

    /**
     * The HTML, if any strategy produced a page.
     */
    Optional<String> html();

    /**
     * Rendered by the primary strategy.
     */
    record Success(String content) implements FetchOutcome {
        @Override
        public Optional<String> html() {
            return Optional.of(content);
        }
    }

    /**
     * Fetched by the fallback strategy after the primary one gave up.
     */
    record Degraded(String content, String primaryFailure) implements FetchOutcome {
        @Override
        public Optional<String> html() {
            return Optional.of(content);
        }
    }

    /**
     * No strategy produced a page.
     */
    record Failure(String reason) implements FetchOutcome {
        @Override
        public Optional<String> html() {
            return Optional.empty();
        }
    }
}
