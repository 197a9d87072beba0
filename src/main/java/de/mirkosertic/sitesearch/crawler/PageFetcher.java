package de.mirkosertic.sitesearch.crawler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Two-stage fetch chain: a primary strategy with retries and a fixed backoff, then a
 * single attempt with the fallback strategy.
 * <p>
 * The primary strategy gets {@code 1 + retries} attempts. A {@link BrowserUnavailableException}
 * ends the primary stage immediately. A blank page counts as a failed attempt, and so does
 * an unchecked exception escaping a strategy. {@link #fetch(String)} never throws.
 */
public class PageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(PageFetcher.class);

    @Nullable
    private final FetchStrategy primary;
    private final FetchStrategy fallback;
    private final int retries;
    private final Duration backoff;

    /**
     * @param primary  the preferred strategy, or null to always use the fallback
     * @param fallback the strategy used once the primary one gave up
     * @param retries  additional primary attempts after the first one
     * @param backoff  pause between primary attempts
     */
    public PageFetcher(@Nullable final FetchStrategy primary, final FetchStrategy fallback,
                       final int retries, final Duration backoff) {
        this.primary = primary;
        this.fallback = fallback;
        this.retries = Math.max(0, retries);
        this.backoff = backoff;
    }

    public FetchOutcome fetch(final String url) {
        String primaryFailure = "primary strategy disabled";
        if (primary != null) {
            final int attempts = retries + 1;
            for (int attempt = 1; attempt <= attempts; attempt++) {
                try {
                    final String html = requirePage(primary.fetch(url));
                    logger.debug("Fetched {} with {} on attempt {}", url, primary.name(), attempt);
                    return new FetchOutcome.Success(html);
                } catch (final BrowserUnavailableException e) {
                    logger.warn("{} unavailable, falling back to {} for {}: {}",
                            primary.name(), fallback.name(), url, e.getMessage());
                    primaryFailure = e.getMessage();
                    break;
                } catch (final FetchException e) {
                    primaryFailure = e.getMessage();
                    logger.warn("Attempt {}/{} with {} failed for {}: {}",
                            attempt, attempts, primary.name(), url, e.getMessage());
                    if (attempt < attempts && !pause()) {
                        return new FetchOutcome.Failure("Interrupted while fetching " + url);
                    }
                } catch (final RuntimeException e) {
                    primaryFailure = describe(e);
                    logger.warn("Attempt {}/{} with {} failed unexpectedly for {}",
                            attempt, attempts, primary.name(), url, e);
                    if (attempt < attempts && !pause()) {
                        return new FetchOutcome.Failure("Interrupted while fetching " + url);
                    }
                }
            }
        }

        try {
            final String html = requirePage(fallback.fetch(url));
            logger.info("Fetched {} with fallback {}", url, fallback.name());
            return new FetchOutcome.Degraded(html, primaryFailure);
        } catch (final FetchException e) {
            logger.error("All fetch strategies failed for {}: {}", url, e.getMessage());
            return new FetchOutcome.Failure(e.getMessage());
        } catch (final RuntimeException e) {
            logger.error("All fetch strategies failed for {}", url, e);
            return new FetchOutcome.Failure(describe(e));
        }
    }

    private static String describe(final RuntimeException e) {
        final String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message.lines().findFirst().orElse(message);
    }

    private static String requirePage(final String html) throws FetchException {
        if (html == null || html.isBlank()) {
            throw new FetchException("Empty page");
        }
        return html;
    }

    private boolean pause() {
        if (backoff.isZero() || backoff.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
