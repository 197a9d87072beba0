package de.mirkosertic.sitesearch.crawler;

import de.mirkosertic.sitesearch.PageDocument;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one crawl task.
 *
 * @param document the stored document, only for {@link Status#CRAWLED}
 * @param reason   why the URL was not crawled, null for {@link Status#CRAWLED}
 */
public record PageResult(String url, Status status, @Nullable PageDocument document, @Nullable String reason) {

    public enum Status {
        CRAWLED,
        FAILED,
        SKIPPED
    }

    public static PageResult crawled(final String url, final PageDocument document) {
        return new PageResult(url, Status.CRAWLED, document, null);
    }

    public static PageResult failed(final String url, final String reason) {
        return new PageResult(url, Status.FAILED, null, reason);
    }

    public static PageResult skipped(final String url) {
        return new PageResult(url, Status.SKIPPED, null, "visited within the revisit window");
    }
}
