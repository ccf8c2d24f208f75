package com.pubannotator.pipeline;

import java.time.Instant;
import java.util.Map;

/**
 * One unit of acquired content moving through the pipeline.
 * <p>
 * Identity fields ({@code id}, {@code identityKey}, payload and locator) are fixed at
 * construction. Status fields are mutated by exactly one owner at a time: the coordinator
 * before scheduling, then the scheduler's worker thread for the duration of the job, so they
 * are kept {@code volatile} and every transition is checked.
 * <p>
 * Transition rules:
 * <ul>
 *   <li>{@code NEW -> SKIPPED} via {@link #markSkipped(SkipReason)} (deduplication, resumable filter).</li>
 *   <li>{@code NEW -> ANNOTATED | FAILED | EXHAUSTED} via the {@code complete*} methods, called by
 *       {@link AnnotationScheduler} only.</li>
 *   <li>Any second terminal transition throws {@link IllegalStateException}.</li>
 * </ul>
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public final class PipelineRecord {
    private final int sequence;
    private final String id;
    private final String identityKey;
    private final String rawPayload;
    private final String sourceLocator;
    private final Map<String, String> metadata;
    private final Instant createdAt;

    private volatile RecordStatus status = RecordStatus.NEW;
    private volatile SkipReason skipReason;
    private volatile Annotation annotation;
    private volatile int attempts;
    private volatile String lastError;
    private volatile Instant updatedAt;

    public PipelineRecord(int sequence, String id, String identityKey, String rawPayload,
                          String sourceLocator, Map<String, String> metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Record id cannot be null or blank");
        }
        if (identityKey == null || identityKey.isBlank()) {
            throw new IllegalArgumentException("Identity key cannot be null or blank");
        }
        this.sequence = sequence;
        this.id = id;
        this.identityKey = identityKey;
        this.rawPayload = rawPayload == null ? "" : rawPayload;
        this.sourceLocator = sourceLocator == null ? identityKey : sourceLocator;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    /** Position of this record in the acquisition order, used to keep reports in encounter order. */
    public int sequence() { return sequence; }
    public String id() { return id; }
    public String identityKey() { return identityKey; }
    public String rawPayload() { return rawPayload; }
    public String sourceLocator() { return sourceLocator; }
    public Map<String, String> metadata() { return metadata; }
    public Instant createdAt() { return createdAt; }
    public RecordStatus status() { return status; }
    public SkipReason skipReason() { return skipReason; }
    public Annotation annotation() { return annotation; }
    public int attempts() { return attempts; }
    public String lastError() { return lastError; }
    public Instant updatedAt() { return updatedAt; }

    public synchronized void markSkipped(SkipReason reason) {
        requireNew("skip");
        this.skipReason = reason;
        this.status = RecordStatus.SKIPPED;
        touch();
    }

    synchronized void recordAttempt() {
        requireNew("attempt");
        attempts++;
        touch();
    }

    synchronized void recordError(String error) {
        requireNew("record error on");
        this.lastError = error;
        touch();
    }

    synchronized void completeAnnotated(Annotation value) {
        requireNew("annotate");
        this.annotation = value;
        this.lastError = null;
        this.status = RecordStatus.ANNOTATED;
        touch();
    }

    synchronized void completeFailed(String error) {
        requireNew("fail");
        this.lastError = error;
        this.status = RecordStatus.FAILED;
        touch();
    }

    synchronized void completeExhausted(String error) {
        requireNew("exhaust");
        this.lastError = error;
        this.status = RecordStatus.EXHAUSTED;
        touch();
    }

    /**
     * Re-exposes this record as an acquisition tuple carrying its assigned id.
     * Feeding the result back through deduplication is a no-op.
     */
    public RawRecord toRawRecord() {
        return new RawRecord(id, identityKey, rawPayload, sourceLocator, metadata);
    }

    private void requireNew(String action) {
        if (status != RecordStatus.NEW) {
            throw new IllegalStateException("Cannot " + action + " record " + id + " in status " + status);
        }
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "PipelineRecord{id=" + id + ", identityKey=" + identityKey + ", status=" + status
            + ", attempts=" + attempts + "}";
    }
}
