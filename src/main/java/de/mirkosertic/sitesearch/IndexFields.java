package de.mirkosertic.sitesearch;

import java.util.List;

/**
 * Field names of the site index. Only {@link #SEARCHABLE} fields are analyzed and queried,
 * the remaining ones are stored for result rendering.
 */
public final class IndexFields {

    public static final String ID = "id";
    public static final String TITLE = "title";
    public static final String CONTENT = "content";
    public static final String DESCRIPTION = "description";
    public static final String LINKS = "links";
    public static final String URL = "url";
    public static final String LAST_CRAWLED = "lastCrawled";

    public static final List<String> SEARCHABLE = List.of(TITLE, CONTENT, DESCRIPTION, LINKS);

    private IndexFields() {
    }

    /**
     * Query-time weight of a searchable field.
     */
    public static float boost(final String field) {
        return switch (field) {
            case TITLE -> 2.0f;
            case DESCRIPTION -> 1.5f;
            default -> 1.0f;
        };
    }
}
