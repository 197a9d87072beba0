package de.mirkosertic.sitesearch;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;

import java.io.IOException;

/**
 * Maps {@link PageDocument}s to Lucene documents and back, with one consistent field schema
 * for the index builder and the query-time index.
 */
public class DocumentIndexer {

    public Document createDocument(final PageDocument page) {
        final Document doc = new Document();

        // id and url - exact match only, stored
        doc.add(new StringField(IndexFields.ID, page.id(), Field.Store.YES));
        doc.add(new StringField(IndexFields.URL, page.url(), Field.Store.YES));

        // searchable fields (analyzed, stored)
        doc.add(new TextField(IndexFields.TITLE, page.title(), Field.Store.YES));
        doc.add(new TextField(IndexFields.DESCRIPTION, page.description(), Field.Store.YES));
        doc.add(new TextField(IndexFields.CONTENT, page.content(), Field.Store.YES));
        doc.add(new TextField(IndexFields.LINKS, page.links(), Field.Store.YES));

        doc.add(new StoredField(IndexFields.LAST_CRAWLED, page.lastCrawled()));
        return doc;
    }

    /**
     * Insert the document, replacing any existing document with the same id.
     */
    public void indexDocument(final IndexWriter writer, final PageDocument page) throws IOException {
        writer.updateDocument(new Term(IndexFields.ID, page.id()), createDocument(page));
    }

    public PageDocument toPageDocument(final Document stored) {
        final IndexableField lastCrawled = stored.getField(IndexFields.LAST_CRAWLED);
        return new PageDocument(
                stored.get(IndexFields.ID),
                valueOrEmpty(stored, IndexFields.TITLE),
                valueOrEmpty(stored, IndexFields.DESCRIPTION),
                valueOrEmpty(stored, IndexFields.CONTENT),
                stored.get(IndexFields.URL),
                valueOrEmpty(stored, IndexFields.LINKS),
                lastCrawled != null && lastCrawled.numericValue() != null ? lastCrawled.numericValue().longValue() : 0L);
    }

    private static String valueOrEmpty(final Document stored, final String field) {
        final String value = stored.get(field);
        return value != null ? value : "";
    }
}
