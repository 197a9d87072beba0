package de.mirkosertic.sitesearch;

/**
 * One ranked search result as returned to clients.
 */
public record SearchHit(
        String id,
        float score,
        String title,
        String description,
        String url,
        String links
) {
}
