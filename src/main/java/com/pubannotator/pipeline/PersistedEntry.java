package com.pubannotator.pipeline;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Durable projection of a {@link PipelineRecord}, keyed by {@code id}.
 * <p>
 * {@code title} and {@code category} are lifted out of the annotation when present so the store
 * can be queried without reading the JSON; {@code content} is the acquired payload.
 * {@code annotation} is null for failed and exhausted records.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public record PersistedEntry(
    String id,
    String identityKey,
    String sourceLocator,
    RecordStatus status,
    String title,
    String category,
    String content,
    Map<String, Object> annotation,
    Map<String, String> metadata,
    int attempts,
    String lastError,
    Instant createdAt,
    Instant updatedAt
) {
    public PersistedEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entry id cannot be null or blank");
        }
        metadata = metadata == null ? Map.of() : metadata;
    }

    /**
     * Projects a record that reached a terminal annotation state.
     */
    public static PersistedEntry from(PipelineRecord record) {
        Annotation annotation = record.annotation();
        return new PersistedEntry(
            record.id(),
            record.identityKey(),
            record.sourceLocator(),
            record.status(),
            annotation == null ? null : annotation.getString("title"),
            annotation == null ? null : annotation.getString("category"),
            record.rawPayload(),
            annotation == null ? null : annotation.toPlainMap(),
            record.metadata(),
            record.attempts(),
            record.lastError(),
            record.createdAt(),
            record.updatedAt()
        );
    }

    public boolean hasAnnotation() {
        return annotation != null;
    }

    /** Same entry content, ignoring timestamps. */
    public boolean sameContentAs(PersistedEntry other) {
        return other != null
            && id.equals(other.id)
            && Objects.equals(identityKey, other.identityKey)
            && Objects.equals(sourceLocator, other.sourceLocator)
            && status == other.status
            && Objects.equals(title, other.title)
            && Objects.equals(category, other.category)
            && Objects.equals(content, other.content)
            && Objects.equals(annotation, other.annotation)
            && Objects.equals(metadata, other.metadata)
            && attempts == other.attempts
            && Objects.equals(lastError, other.lastError);
    }

    /** Copy with different timestamps, used when the store keeps the original creation time. */
    public PersistedEntry withTimestamps(Instant created, Instant updated) {
        return new PersistedEntry(id, identityKey, sourceLocator, status, title, category, content,
            annotation, metadata, attempts, lastError, created, updated);
    }
}
