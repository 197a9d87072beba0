package de.mirkosertic.sitesearch.crawler;

import java.util.List;

/**
 * Result of extracting one HTML page.
 *
 * @param links           canonical same-origin URLs discovered on the page, in document order
 * @param serializedLinks the same links as {@code "text (href)"} pairs joined by {@code ", "}
 */
public record ExtractedPage(
        String url,
        String title,
        String description,
        String content,
        List<String> links,
        String serializedLinks
) {
}
