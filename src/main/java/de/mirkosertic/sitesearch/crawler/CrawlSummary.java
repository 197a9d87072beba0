package de.mirkosertic.sitesearch.crawler;

import java.util.List;

/**
 * Result of one crawl invocation, returned to the caller that triggered it.
 *
 * @param pagesCrawled     number of pages fetched and stored
 * @param documentsIndexed documents in the persisted snapshot, 0 when indexing was skipped
 */
public record CrawlSummary(
        String crawlId,
        int pagesCrawled,
        List<String> crawledUrls,
        List<String> failedUrls,
        List<String> skippedUrls,
        int documentsIndexed,
        long elapsedMs,
        String message
) {
}
