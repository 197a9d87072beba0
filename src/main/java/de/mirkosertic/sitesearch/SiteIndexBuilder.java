package de.mirkosertic.sitesearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * In-memory index that collects crawled documents and turns them into a snapshot.
 * <p>
 * Documents are upserted by id, so seeding the builder with the previous snapshot and
 * adding the pages of the current crawl merges both, with re-crawled pages replacing
 * their older versions.
 */
public class SiteIndexBuilder implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(SiteIndexBuilder.class);

    private final SnapshotStore snapshotStore;
    private final DocumentIndexer documentIndexer;
    private final ByteBuffersDirectory directory;
    private final IndexWriter writer;

    public SiteIndexBuilder(final SnapshotStore snapshotStore, final Analyzer analyzer) throws IOException {
        this.snapshotStore = snapshotStore;
        this.documentIndexer = new DocumentIndexer();
        this.directory = new ByteBuffersDirectory();
        final IndexWriterConfig writerConfig = new IndexWriterConfig(analyzer);
        writerConfig.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        this.writer = new IndexWriter(directory, writerConfig);
    }

    /**
     * Start from the documents of an existing snapshot.
     */
    public void seed(final IndexSnapshot snapshot) throws IOException {
        addAll(snapshot.documents());
        logger.debug("Seeded index builder with {} documents", snapshot.documents().size());
    }

    /**
     * @throws IllegalArgumentException if a document lacks an id or url, or has a null field
     */
    public void addAll(final Collection<PageDocument> documents) throws IOException {
        for (final PageDocument document : documents) {
            validate(document);
            documentIndexer.indexDocument(writer, document);
        }
        writer.commit();
    }

    public int documentCount() throws IOException {
        writer.commit();
        try (final DirectoryReader reader = DirectoryReader.open(directory)) {
            return reader.numDocs();
        }
    }

    /**
     * All documents currently held, ordered by url.
     */
    public IndexSnapshot snapshot() throws IOException {
        writer.commit();
        final List<PageDocument> documents = new ArrayList<>();
        try (final DirectoryReader reader = DirectoryReader.open(directory)) {
            if (reader.numDocs() > 0) {
                final IndexSearcher searcher = new IndexSearcher(reader);
                final TopDocs topDocs = searcher.search(new MatchAllDocsQuery(), reader.numDocs());
                for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    documents.add(documentIndexer.toPageDocument(searcher.storedFields().document(scoreDoc.doc)));
                }
            }
        }
        documents.sort(Comparator.comparing(PageDocument::url));
        return new IndexSnapshot(IndexFields.SEARCHABLE, documents);
    }

    /**
     * Write the current documents as the new snapshot, replacing the previous one.
     *
     * @throws IndexingException if there is nothing to persist
     */
    public IndexSnapshot persist() throws IOException {
        final IndexSnapshot snapshot = snapshot();
        if (snapshot.isEmpty()) {
            throw new IndexingException("No documents to index");
        }
        snapshotStore.persist(snapshot);
        return snapshot;
    }

    @Override
    public void close() throws IOException {
        writer.close();
        directory.close();
    }

    private static void validate(final PageDocument document) {
        if (document.id() == null || document.id().isBlank()) {
            throw new IllegalArgumentException("Document without id: " + document.url());
        }
        if (document.url() == null || document.url().isBlank()) {
            throw new IllegalArgumentException("Document without url: " + document.id());
        }
        if (document.title() == null || document.description() == null
                || document.content() == null || document.links() == null) {
            throw new IllegalArgumentException("Document with missing field: " + document.url());
        }
    }
}
