package com.pubannotator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one pass of the pipeline over an acquisition source.
 * <p>
 * Stages: {@code LOADING -> DEDUPLICATING -> FILTERING -> ANNOTATING -> PERSISTING -> COMPLETED}.
 * <ul>
 *   <li><b>Loading</b>: reads the source; a read error or an empty source fails the run.</li>
 *   <li><b>Deduplicating</b>: {@link RecordDeduplicator} with an {@link IdGenerator} owned by this run.
 *       Records the store already knows by identity key get their stored id back.</li>
 *   <li><b>Filtering</b>: skips records the store already holds an annotation for, and records
 *       marked {@code FAILED} unless {@link PipelineConfig#resetFailed()} is set.</li>
 *   <li><b>Annotating</b>: {@link AnnotationScheduler}; each resolved record is upserted right away
 *       from the worker thread, failures included, so an interrupted run keeps its progress.</li>
 *   <li><b>Persisting</b>: upserts that failed during annotation are retried with the
 *       persistence {@link RetryPolicy}.</li>
 * </ul>
 * Per-record errors never stop the run. The run fails when the store stays unreachable:
 * {@code persistAttempts} consecutive upsert failures during annotation, or a retry queue that
 * still fails in the persisting stage. {@link #cancel()} ends the run as {@code CANCELLED} after
 * in-flight work drains.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class PipelineCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final PipelineConfig config;
    private final AnnotationServiceInterface annotationService;
    private final PersistenceServiceInterface persistence;
    private final AnnotationSchema schema;
    private final RetryPolicy annotationPolicy;
    private final RetryPolicy persistencePolicy;
    private final RecordDeduplicator deduplicator = new RecordDeduplicator();
    private final OutputParser parser = new OutputParser();

    private volatile boolean cancelRequested;
    private volatile AnnotationScheduler scheduler;
    private volatile RunStatus status = RunStatus.LOADING;

    public PipelineCoordinator(PipelineConfig config, AnnotationServiceInterface annotationService,
                               PersistenceServiceInterface persistence, AnnotationSchema schema) {
        this(config, annotationService, persistence, schema,
            RetryPolicy.forAnnotation(config), RetryPolicy.forPersistence(config));
    }

    public PipelineCoordinator(PipelineConfig config, AnnotationServiceInterface annotationService,
                               PersistenceServiceInterface persistence, AnnotationSchema schema,
                               RetryPolicy annotationPolicy, RetryPolicy persistencePolicy) {
        this.config = config;
        this.annotationService = annotationService;
        this.persistence = persistence;
        this.schema = schema;
        this.annotationPolicy = annotationPolicy;
        this.persistencePolicy = persistencePolicy;
    }

    public RunStatus status() {
        return status;
    }

    /**
     * Requests run-level cancellation: no new annotation attempts start, in-flight ones drain
     * within the configured grace period. Already persisted entries are untouched.
     */
    public void cancel() {
        cancelRequested = true;
        AnnotationScheduler current = scheduler;
        if (current != null) current.cancel();
        logger.warn("Cancellation requested during {}.", status);
    }

    public RunSummary run(AcquisitionServiceInterface source) {
        RunSummary summary = new RunSummary(source.describe());
        status = RunStatus.LOADING;
        logger.info("Run stage: {}", status);
        try {
            List<RawRecord> raw = load(source, summary);
            if (stopIfCancelled(summary)) return summary;

            enter(RunStatus.DEDUPLICATING, summary);
            Map<String, String> storedIds =
                readWithRetry(persistence::idsByIdentityKey, "idsByIdentityKey", RunStatus.DEDUPLICATING);
            DedupResult dedup = deduplicator.deduplicate(raw, new IdGenerator(config.idPrefix()), storedIds);
            summary.recordDuplicates(dedup.duplicates());
            if (stopIfCancelled(summary)) return summary;

            enter(RunStatus.FILTERING, summary);
            List<PipelineRecord> pending = filter(dedup.survivors(), summary);
            if (stopIfCancelled(summary)) return summary;

            enter(RunStatus.ANNOTATING, summary);
            ConcurrentLinkedQueue<PersistedEntry> retryQueue = new ConcurrentLinkedQueue<>();
            AtomicReference<PersistenceException> sinkFailure = new AtomicReference<>();
            annotate(pending, summary, retryQueue, sinkFailure);
            if (sinkFailure.get() != null) {
                throw new FatalPipelineException(RunStatus.ANNOTATING,
                    "Store unreachable after " + config.persistAttempts() + " consecutive upsert failures: "
                        + sinkFailure.get().getMessage(), sinkFailure.get());
            }

            enter(RunStatus.PERSISTING, summary);
            flush(retryQueue, summary);

            enter(cancelRequested ? RunStatus.CANCELLED : RunStatus.COMPLETED, summary);
        } catch (FatalPipelineException e) {
            status = RunStatus.FAILED;
            summary.fail(e.getMessage());
            logger.error("Run failed during {}: {}", e.stage(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            AnnotationScheduler current = scheduler;
            if (current != null) current.cancel();
            logger.warn("Run interrupted during {}.", status);
            enter(RunStatus.CANCELLED, summary);
        }
        logger.info("\n{}", summary.format());
        return summary;
    }

    private List<RawRecord> load(AcquisitionServiceInterface source, RunSummary summary) throws FatalPipelineException {
        List<RawRecord> raw;
        try {
            raw = source.acquire();
        } catch (IOException | RuntimeException e) {
            throw new FatalPipelineException(RunStatus.LOADING, "Acquisition from " + source.describe() + " failed: " + e.getMessage(), e);
        }
        if (raw == null || raw.isEmpty()) {
            throw new FatalPipelineException(RunStatus.LOADING, "Acquisition from " + source.describe() + " produced no records");
        }
        summary.recordAcquired(raw.size());
        logger.info("Acquired {} raw records from {}.", raw.size(), source.describe());
        return raw;
    }

    private List<PipelineRecord> filter(List<PipelineRecord> survivors, RunSummary summary)
            throws FatalPipelineException, InterruptedException {
        List<PipelineRecord> pending = new ArrayList<>();
        for (PipelineRecord record : survivors) {
            if (readWithRetry(() -> persistence.alreadyProcessed(record.id()), "alreadyProcessed " + record.id(), RunStatus.FILTERING)) {
                record.markSkipped(SkipReason.ALREADY_PROCESSED);
                summary.recordSkipped(SkipReason.ALREADY_PROCESSED);
            } else if (!config.resetFailed()
                    && readWithRetry(() -> persistence.markedFailed(record.id()), "markedFailed " + record.id(), RunStatus.FILTERING)) {
                record.markSkipped(SkipReason.PREVIOUSLY_FAILED);
                summary.recordSkipped(SkipReason.PREVIOUSLY_FAILED);
            } else {
                pending.add(record);
            }
        }
        logger.info("{} of {} unique records need annotation ({} already processed, {} previously failed).",
            pending.size(), survivors.size(), summary.skippedAlreadyProcessed(), summary.skippedPreviouslyFailed());
        return pending;
    }

    private <T> T readWithRetry(RetryPolicy.Action<T, PersistenceException> read, String desc, RunStatus stage)
            throws FatalPipelineException, InterruptedException {
        try {
            return persistencePolicy.execute(read, e -> e instanceof PersistenceException, desc);
        } catch (PersistenceException e) {
            throw new FatalPipelineException(stage, "Store unreachable: " + e.getMessage(), e);
        }
    }

    private void annotate(List<PipelineRecord> pending, RunSummary summary,
                          ConcurrentLinkedQueue<PersistedEntry> retryQueue,
                          AtomicReference<PersistenceException> sinkFailure) throws InterruptedException {
        if (pending.isEmpty()) {
            logger.info("Nothing to annotate.");
            return;
        }
        AnnotationScheduler current = new AnnotationScheduler(annotationService, parser, annotationPolicy,
            config.concurrency(), config.promptContext());
        scheduler = current;
        if (cancelRequested) current.cancel();

        AtomicInteger consecutiveFailures = new AtomicInteger();
        AnnotationScheduler.Report report = current.run(pending, schema, job -> {
            PipelineRecord record = job.record();
            summary.recordOutcome(record);
            PersistedEntry entry = PersistedEntry.from(record);
            try {
                persistence.upsert(entry);
                summary.recordPersisted();
                consecutiveFailures.set(0);
            } catch (PersistenceException e) {
                retryQueue.add(entry);
                int failures = consecutiveFailures.incrementAndGet();
                logger.warn("Upsert of {} failed ({} in a row): {}", record.id(), failures, e.getMessage());
                if (failures >= config.persistAttempts() && sinkFailure.compareAndSet(null, e)) {
                    logger.error("Store looks unreachable; cancelling annotation.");
                    current.cancel();
                }
            }
        }, config.gracePeriod());
        summary.recordCancelled(report.cancelled());
    }

    private void flush(ConcurrentLinkedQueue<PersistedEntry> retryQueue, RunSummary summary)
            throws FatalPipelineException, InterruptedException {
        if (retryQueue.isEmpty()) return;
        logger.info("Retrying {} failed upsert(s).", retryQueue.size());
        PersistedEntry entry;
        while ((entry = retryQueue.poll()) != null) {
            PersistedEntry toWrite = entry;
            try {
                persistencePolicy.execute(() -> {
                    persistence.upsert(toWrite);
                    return null;
                }, e -> e instanceof PersistenceException, "upsert " + toWrite.id());
                summary.recordPersisted();
            } catch (PersistenceException e) {
                throw new FatalPipelineException(RunStatus.PERSISTING,
                    "Store unreachable while persisting " + toWrite.id() + ": " + e.getMessage(), e);
            }
        }
    }

    private boolean stopIfCancelled(RunSummary summary) {
        if (!cancelRequested) return false;
        enter(RunStatus.CANCELLED, summary);
        logger.info("\n{}", summary.format());
        return true;
    }

    private void enter(RunStatus next, RunSummary summary) {
        logger.info("Run stage: {} -> {}", status, next);
        status = next;
        summary.setStatus(next);
    }
}
