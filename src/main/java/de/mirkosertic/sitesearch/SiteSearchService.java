package de.mirkosertic.sitesearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.search.Query;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Answers free-text queries against the latest persisted snapshot.
 * <p>
 * The snapshot is loaded and indexed for every request, so results always reflect the
 * most recently completed crawl without any cache invalidation.
 */
public class SiteSearchService {

    private static final Logger logger = LoggerFactory.getLogger(SiteSearchService.class);

    private final SnapshotStore snapshotStore;
    private final Analyzer analyzer;
    private final SiteQueryBuilder queryBuilder;
    private final int maxResults;

    public SiteSearchService(final SnapshotStore snapshotStore, final Analyzer analyzer, final int maxResults) {
        this.snapshotStore = snapshotStore;
        this.analyzer = analyzer;
        this.queryBuilder = new SiteQueryBuilder(analyzer);
        this.maxResults = maxResults;
    }

    /**
     * @throws InvalidQueryException       if the query is missing or blank
     * @throws IndexNotPopulatedException  if no crawl has produced any documents yet
     * @throws IOException                 if the in-memory index cannot be built
     */
    public List<SearchHit> search(@Nullable final String query) throws IOException {
        if (query == null || query.isBlank()) {
            throw new InvalidQueryException("Query parameter is required");
        }

        final IndexSnapshot snapshot = snapshotStore.load();
        if (snapshot.isEmpty()) {
            throw new IndexNotPopulatedException("Index is empty, run a crawl first");
        }

        final Optional<Query> luceneQuery = queryBuilder.build(query);
        if (luceneQuery.isEmpty()) {
            logger.debug("Query '{}' contains no searchable terms", query);
            return List.of();
        }

        final long startTime = System.nanoTime();
        try (final SiteSearchIndex index = new SiteSearchIndex(snapshot, analyzer)) {
            final List<SearchHit> hits = index.search(luceneQuery.get(), maxResults);
            logger.debug("Query '{}' matched {} of {} documents in {}ms", query, hits.size(),
                    index.documentCount(), (System.nanoTime() - startTime) / 1_000_000);
            return hits;
        }
    }
}
