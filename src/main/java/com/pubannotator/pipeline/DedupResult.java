package com.pubannotator.pipeline;

import java.util.List;

/**
 * Output of {@link RecordDeduplicator}: surviving records and the dropped duplicates, both in
 * encounter order.
 */
public record DedupResult(List<PipelineRecord> survivors, List<Duplicate> duplicates) {

    public DedupResult {
        survivors = List.copyOf(survivors);
        duplicates = List.copyOf(duplicates);
    }

    /**
     * A raw record dropped because an earlier record had the same identity key.
     * @param sequence position in the acquisition order
     * @param identityKey the shared identity key
     * @param sourceLocator where the dropped copy came from
     * @param keptId id of the first occurrence that was kept
     */
    public record Duplicate(int sequence, String identityKey, String sourceLocator, String keptId) {}
}
