package de.mirkosertic.sitesearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only in-memory index restored from a snapshot, used for a single search request.
 */
public class SiteSearchIndex implements Closeable {

    private final ByteBuffersDirectory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;

    public SiteSearchIndex(final IndexSnapshot snapshot, final Analyzer analyzer) throws IOException {
        this.directory = new ByteBuffersDirectory();
        final DocumentIndexer documentIndexer = new DocumentIndexer();
        try (final IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(analyzer))) {
            for (final PageDocument document : snapshot.documents()) {
                documentIndexer.indexDocument(writer, document);
            }
            writer.commit();
        }
        this.reader = DirectoryReader.open(directory);
        this.searcher = new IndexSearcher(reader);
    }

    public int documentCount() {
        return reader.numDocs();
    }

    /**
     * Top hits by descending score, ties in index order.
     */
    public List<SearchHit> search(final Query query, final int maxResults) throws IOException {
        if (maxResults <= 0 || reader.numDocs() == 0) {
            return List.of();
        }
        final TopDocs topDocs = searcher.search(query, maxResults);
        final List<SearchHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
        for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
            final Document doc = searcher.storedFields().document(scoreDoc.doc);
            hits.add(new SearchHit(
                    doc.get(IndexFields.ID),
                    scoreDoc.score,
                    doc.get(IndexFields.TITLE),
                    doc.get(IndexFields.DESCRIPTION),
                    doc.get(IndexFields.URL),
                    doc.get(IndexFields.LINKS)));
        }
        return hits;
    }

    @Override
    public void close() throws IOException {
        reader.close();
        directory.close();
    }
}
