package de.mirkosertic.sitesearch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.sitesearch.PageDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Keeps crawled documents in the key-value store as JSON under {@code index:<id>}.
 */
public class DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(DocumentStore.class);

    static final String KEY_PREFIX = "index:";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public DocumentStore(final KeyValueStore store, final ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Stores the document, replacing any previous version with the same id.
     */
    public void save(final PageDocument document) {
        final String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("Document cannot be serialized: " + document.url(), e);
        }
        store.set(KEY_PREFIX + document.id(), json);
        logger.debug("Stored document {} for {}", document.id(), document.url());
    }

    public Optional<PageDocument> find(final String id) {
        final String json = store.get(KEY_PREFIX + id);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PageDocument.class));
        } catch (final JsonProcessingException e) {
            logger.warn("Ignoring unreadable document {}: {}", id, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
