package de.mirkosertic.sitesearch;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Serialized form of the search index: the searchable field list plus every document.
 * Each persist fully replaces the previous snapshot.
 */
public record IndexSnapshot(List<String> fields, List<PageDocument> documents) {

    public IndexSnapshot {
        fields = List.copyOf(fields);
        documents = List.copyOf(documents);
    }

    public static IndexSnapshot empty() {
        return new IndexSnapshot(IndexFields.SEARCHABLE, List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
