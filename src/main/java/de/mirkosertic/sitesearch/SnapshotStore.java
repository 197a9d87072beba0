package de.mirkosertic.sitesearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the index snapshot file.
 * <p>
 * Writes go to a temporary file next to the snapshot which is then moved over it, so a
 * reader sees either the old or the new snapshot, never a partial one. There are two ways
 * to read: {@link #load()} for searching and {@link #loadForUpdate()} before a merge.
 */
public class SnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);

    private static final List<String> REQUIRED_TEXT_PROPERTIES = List.of(
            "id", "url", IndexFields.TITLE, IndexFields.DESCRIPTION, IndexFields.CONTENT, IndexFields.LINKS);

    private final Path snapshotPath;
    private final ObjectMapper objectMapper;

    public SnapshotStore(final Path snapshotPath, final ObjectMapper objectMapper) {
        this.snapshotPath = snapshotPath;
        this.objectMapper = objectMapper;
    }

    public Path getSnapshotPath() {
        return snapshotPath;
    }

    public void persist(final IndexSnapshot snapshot) throws IOException {
        final Path directory = snapshotPath.toAbsolutePath().getParent();
        Files.createDirectories(directory);

        final Path tempFile = Files.createTempFile(directory, snapshotPath.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(tempFile.toFile(), snapshot);
            try {
                Files.move(tempFile, snapshotPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(tempFile, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
        logger.info("Persisted index snapshot with {} documents to {}", snapshot.documents().size(), snapshotPath);
    }

    /**
     * Lenient read for the query path. A missing, unreadable or malformed file is treated
     * as an empty snapshot.
     */
    public IndexSnapshot load() {
        try {
            return read();
        } catch (final IndexingException e) {
            logger.warn("{}, treating it as empty", e.getMessage());
            return IndexSnapshot.empty();
        }
    }

    /**
     * Strict read before a merge. Only a missing file counts as an empty snapshot.
     *
     * @throws IndexingException if the file exists but cannot be read or is malformed
     */
    public IndexSnapshot loadForUpdate() {
        return read();
    }

    private IndexSnapshot read() {
        if (!Files.isRegularFile(snapshotPath)) {
            logger.info("No index snapshot at {}", snapshotPath);
            return IndexSnapshot.empty();
        }

        final JsonNode root;
        try {
            root = objectMapper.readTree(snapshotPath.toFile());
        } catch (final JsonProcessingException e) {
            throw new IndexingException("Index snapshot " + snapshotPath + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (final IOException e) {
            throw new IndexingException("Could not read index snapshot " + snapshotPath + ": " + e.getMessage(), e);
        }

        final IndexSnapshot snapshot = parse(root).orElseThrow(
                () -> new IndexingException("Index snapshot " + snapshotPath + " has an unexpected structure"));
        logger.debug("Loaded index snapshot with {} documents", snapshot.documents().size());
        return snapshot;
    }

    private Optional<IndexSnapshot> parse(final JsonNode root) {
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        final JsonNode fieldsNode = root.get("fields");
        final JsonNode documentsNode = root.get("documents");
        if (fieldsNode == null || !fieldsNode.isArray() || documentsNode == null || !documentsNode.isArray()) {
            return Optional.empty();
        }

        final List<String> fields = new ArrayList<>();
        for (final JsonNode field : fieldsNode) {
            if (!field.isTextual()) {
                return Optional.empty();
            }
            fields.add(field.asText());
        }
        if (!fields.equals(IndexFields.SEARCHABLE)) {
            logger.warn("Index snapshot was written with fields {}, expected {}", fields, IndexFields.SEARCHABLE);
            return Optional.empty();
        }

        final List<PageDocument> documents = new ArrayList<>(documentsNode.size());
        for (final JsonNode document : documentsNode) {
            if (!document.isObject()) {
                return Optional.empty();
            }
            for (final String property : REQUIRED_TEXT_PROPERTIES) {
                final JsonNode value = document.get(property);
                if (value == null || !value.isTextual()) {
                    return Optional.empty();
                }
            }
            final JsonNode lastCrawled = document.get("lastCrawled");
            documents.add(new PageDocument(
                    document.get("id").asText(),
                    document.get(IndexFields.TITLE).asText(),
                    document.get(IndexFields.DESCRIPTION).asText(),
                    document.get(IndexFields.CONTENT).asText(),
                    document.get("url").asText(),
                    document.get(IndexFields.LINKS).asText(),
                    lastCrawled != null && lastCrawled.canConvertToLong() ? lastCrawled.asLong() : 0L));
        }
        return Optional.of(new IndexSnapshot(fields, documents));
    }
}
