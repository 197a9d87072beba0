package de.mirkosertic.sitesearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SiteIndexBuilder Tests")
class SiteIndexBuilderTest {

    @TempDir
    Path tempDir;

    private SnapshotStore snapshotStore;
    private SiteIndexBuilder builder;

    @BeforeEach
    void setUp() throws IOException {
        snapshotStore = new SnapshotStore(tempDir.resolve("snapshot.json"), new ObjectMapper());
        builder = new SiteIndexBuilder(snapshotStore, new SiteTextAnalyzer());
    }

    @AfterEach
    void tearDown() throws IOException {
        builder.close();
    }

    private static PageDocument document(final String url, final String title, final long lastCrawled) {
        return new PageDocument(PageDocument.idFor(url), title, "", "text", url, "", lastCrawled);
    }

    @Test
    @DisplayName("Documents with the same id should be upserted")
    void shouldUpsertById() throws IOException {
        // Given
        builder.seed(new IndexSnapshot(IndexFields.SEARCHABLE, List.of(
                document("https://example.com/b", "B old", 1L),
                document("https://example.com/a", "A", 1L))));

        // When
        builder.addAll(List.of(document("https://example.com/b", "B new", 2L)));

        // Then
        assertThat(builder.documentCount()).isEqualTo(2);
        final IndexSnapshot snapshot = builder.snapshot();
        assertThat(snapshot.fields()).containsExactly("title", "content", "description", "links");
        assertThat(snapshot.documents()).extracting(PageDocument::title).containsExactly("A", "B new");
        assertThat(snapshot.documents().get(1).lastCrawled()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Persist should write the merged snapshot")
    void shouldPersistSnapshot() throws IOException {
        builder.addAll(List.of(document("https://example.com/", "Home", 5L)));

        final IndexSnapshot persisted = builder.persist();

        assertThat(snapshotStore.load()).isEqualTo(persisted);
    }

    @Test
    @DisplayName("Persisting an empty index should fail")
    void shouldRejectEmptyPersist() {
        assertThatThrownBy(() -> builder.persist())
                .isInstanceOf(IndexingException.class)
                .hasMessageContaining("No documents");
    }

    @Test
    @DisplayName("Documents without url should be rejected")
    void shouldValidateDocuments() {
        final PageDocument invalid = new PageDocument("id", "t", "", "c", "", "", 0L);

        assertThatThrownBy(() -> builder.addAll(List.of(invalid)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
