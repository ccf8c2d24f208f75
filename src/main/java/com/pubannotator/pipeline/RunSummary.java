package com.pubannotator.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outcome of one pipeline run: per-outcome counts, the final {@link RunStatus}, skipped
 * duplicates and failed records.
 * <p>
 * Counters are updated concurrently from scheduler worker threads. Listings are returned in
 * encounter order regardless of completion order.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class RunSummary {

    /** A record that ended FAILED or EXHAUSTED, kept for manual re-inspection. */
    public record FailedRecord(int sequence, String id, String sourceLocator, RecordStatus status, int attempts, String lastError) {}

    private final String source;
    private final Instant startedAt = Instant.now();
    private volatile Instant finishedAt;
    private volatile RunStatus status = RunStatus.LOADING;
    private volatile String fatalError;

    private final AtomicInteger acquired = new AtomicInteger();
    private final AtomicInteger skippedDuplicate = new AtomicInteger();
    private final AtomicInteger skippedAlreadyProcessed = new AtomicInteger();
    private final AtomicInteger skippedPreviouslyFailed = new AtomicInteger();
    private final AtomicInteger annotated = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger exhausted = new AtomicInteger();
    private final AtomicInteger cancelled = new AtomicInteger();
    private final AtomicInteger persisted = new AtomicInteger();

    private final List<DedupResult.Duplicate> duplicates = new ArrayList<>();
    private final ConcurrentLinkedQueue<FailedRecord> failures = new ConcurrentLinkedQueue<>();

    public RunSummary(String source) {
        this.source = source;
    }

    void setStatus(RunStatus status) {
        this.status = status;
        if (status.isTerminal()) {
            this.finishedAt = Instant.now();
        }
    }

    void fail(String error) {
        this.fatalError = error;
        setStatus(RunStatus.FAILED);
    }

    void recordAcquired(int count) { acquired.addAndGet(count); }

    void recordDuplicates(List<DedupResult.Duplicate> dups) {
        synchronized (duplicates) {
            duplicates.addAll(dups);
        }
        skippedDuplicate.addAndGet(dups.size());
    }

    /** Counts a record skipped by the store check. Duplicates go through {@link #recordDuplicates(List)}. */
    void recordSkipped(SkipReason reason) {
        switch (reason) {
            case ALREADY_PROCESSED -> skippedAlreadyProcessed.incrementAndGet();
            case PREVIOUSLY_FAILED -> skippedPreviouslyFailed.incrementAndGet();
            default -> throw new IllegalArgumentException("Not a store skip: " + reason);
        }
    }

    void recordOutcome(PipelineRecord record) {
        switch (record.status()) {
            case ANNOTATED -> annotated.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
            case EXHAUSTED -> exhausted.incrementAndGet();
            default -> throw new IllegalArgumentException("Not an annotation outcome: " + record.status());
        }
        if (record.status() != RecordStatus.ANNOTATED) {
            failures.add(new FailedRecord(record.sequence(), record.id(), record.sourceLocator(), record.status(),
                record.attempts(), record.lastError()));
        }
    }

    void recordCancelled(int count) { cancelled.addAndGet(count); }

    void recordPersisted() { persisted.incrementAndGet(); }

    public String source() { return source; }
    public RunStatus status() { return status; }
    public String fatalError() { return fatalError; }
    public Instant startedAt() { return startedAt; }
    public Instant finishedAt() { return finishedAt; }
    public int acquired() { return acquired.get(); }
    public int skippedDuplicate() { return skippedDuplicate.get(); }
    public int skippedAlreadyProcessed() { return skippedAlreadyProcessed.get(); }
    public int skippedPreviouslyFailed() { return skippedPreviouslyFailed.get(); }
    public int annotated() { return annotated.get(); }
    public int failed() { return failed.get(); }
    public int exhausted() { return exhausted.get(); }
    public int cancelled() { return cancelled.get(); }
    public int persisted() { return persisted.get(); }

    public Duration elapsed() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Duration.between(startedAt, end);
    }

    /** Dropped duplicates in encounter order. */
    public List<DedupResult.Duplicate> duplicates() {
        synchronized (duplicates) {
            List<DedupResult.Duplicate> copy = new ArrayList<>(duplicates);
            copy.sort(Comparator.comparingInt(DedupResult.Duplicate::sequence));
            return copy;
        }
    }

    /** Failed and exhausted records in encounter order. */
    public List<FailedRecord> failures() {
        List<FailedRecord> copy = new ArrayList<>(failures);
        copy.sort(Comparator.comparingInt(FailedRecord::sequence));
        return copy;
    }

    /** Multi-line, human-readable report for logs and the console. */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Run ").append(status).append(" for ").append(source)
          .append(" in ").append(elapsed().toMillis()).append(" ms\n");
        if (fatalError != null) {
            sb.append("  fatal error: ").append(fatalError).append('\n');
        }
        sb.append("  acquired:                  ").append(acquired()).append('\n')
          .append("  skipped (duplicate):       ").append(skippedDuplicate()).append('\n')
          .append("  skipped (already done):    ").append(skippedAlreadyProcessed()).append('\n')
          .append("  skipped (previously failed): ").append(skippedPreviouslyFailed()).append('\n')
          .append("  annotated:                 ").append(annotated()).append('\n')
          .append("  failed:                    ").append(failed()).append('\n')
          .append("  exhausted:                 ").append(exhausted()).append('\n')
          .append("  cancelled:                 ").append(cancelled()).append('\n')
          .append("  persisted:                 ").append(persisted()).append('\n');
        for (DedupResult.Duplicate dup : duplicates()) {
            sb.append("  duplicate ").append(dup.identityKey()).append(" from ").append(dup.sourceLocator())
              .append(" (kept ").append(dup.keptId()).append(")\n");
        }
        for (FailedRecord f : failures()) {
            sb.append("  ").append(f.status()).append(' ').append(f.id()).append(" after ").append(f.attempts())
              .append(" attempt(s): ").append(Utils.truncate(f.lastError(), 300)).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RunSummary{status=" + status + ", annotated=" + annotated() + ", failed=" + failed()
            + ", exhausted=" + exhausted() + ", skippedDuplicate=" + skippedDuplicate()
            + ", skippedAlreadyProcessed=" + skippedAlreadyProcessed() + "}";
    }
}
