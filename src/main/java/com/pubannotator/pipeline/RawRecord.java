package com.pubannotator.pipeline;

import java.util.Map;

/**
 * Immutable tuple produced by an acquisition source.
 * <p>
 * {@code id} is optional: when the source has no stable identifier of its own it is left null
 * and {@link RecordDeduplicator} assigns one. {@code naturalKey} is the source's natural identifier
 * (usually a URL) and is canonicalized into the identity key by {@link IdentityKeys}.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public record RawRecord(
    String id,
    String naturalKey,
    String rawPayload,
    String sourceLocator,
    Map<String, String> metadata
) {
    public RawRecord {
        if (naturalKey == null || naturalKey.isBlank()) {
            throw new IllegalArgumentException("naturalKey cannot be null or blank");
        }
        rawPayload = rawPayload == null ? "" : rawPayload;
        sourceLocator = sourceLocator == null ? naturalKey : sourceLocator;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        id = (id == null || id.isBlank()) ? null : id.trim();
    }

    public RawRecord(String naturalKey, String rawPayload) {
        this(null, naturalKey, rawPayload, naturalKey, Map.of());
    }
}
