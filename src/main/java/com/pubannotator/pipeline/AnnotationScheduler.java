package com.pubannotator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded-concurrency driver for the annotation service.
 * <p>
 * Workflow per record:
 * <ul>
 *   <li>An attempt runs on one of {@code concurrency} worker threads: the payload is sent to the
 *       {@link AnnotationServiceInterface} and the response handed to the {@link OutputParser}.</li>
 *   <li>A valid result resolves the job {@code SUCCEEDED} and the record {@code ANNOTATED}.</li>
 *   <li>A parse or validation error is retried while the {@link RetryPolicy} has attempts left,
 *       then resolves {@code FAILED}.</li>
 *   <li>A retryable transport error is retried the same way, then resolves {@code EXHAUSTED};
 *       a non-retryable one resolves {@code EXHAUSTED} at once. Transport errors never resolve
 *       {@code FAILED}, so a later run tries the record again.</li>
 *   <li>Backoff waits are scheduled on a timer thread, so a job waiting to retry does not hold a
 *       worker and does not count as in flight.</li>
 * </ul>
 * Every job reaches exactly one terminal state; a countdown latch sized to the batch makes
 * {@link #run} return only when all of them did. The completion listener runs once per job on the
 * worker thread that resolved it. {@link #cancel()} stops new attempts; in-flight attempts get the
 * grace period to finish before they are interrupted and their jobs abandoned as
 * {@code CANCELLED} (the record stays {@code NEW}).
 * <p>
 * One instance runs one batch.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class AnnotationScheduler {
    private static final Logger logger = LoggerFactory.getLogger(AnnotationScheduler.class);
    private static final long POLL_MS = 50;

    /** Callback for jobs that reached a terminal state. */
    @FunctionalInterface
    public interface CompletionListener {
        void onComplete(AnnotationJob job);
    }

    /** Aggregate outcome of one batch. */
    public record Report(int submitted, int annotated, int failed, int exhausted, int cancelled, int maxInFlight) {
        public int failures() {
            return failed + exhausted;
        }
    }

    private final AnnotationServiceInterface annotationService;
    private final OutputParser parser;
    private final RetryPolicy retryPolicy;
    private final int concurrency;
    private final String promptContext;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger annotated = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger exhausted = new AtomicInteger();
    private final AtomicInteger abandoned = new AtomicInteger();

    private ThreadPoolExecutor workers;
    private ScheduledExecutorService backoffTimer;
    private CountDownLatch remaining;
    private AnnotationSchema schema;
    private CompletionListener listener;

    public AnnotationScheduler(AnnotationServiceInterface annotationService, OutputParser parser,
                               RetryPolicy retryPolicy, int concurrency, String promptContext) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1");
        }
        this.annotationService = annotationService;
        this.parser = parser;
        this.retryPolicy = retryPolicy;
        this.concurrency = concurrency;
        this.promptContext = promptContext;
    }

    /**
     * Annotates every record and blocks until each job is resolved.
     * @param records Records in status {@code NEW}
     * @param schema Expected response shape
     * @param listener Called once per resolved job, on a worker thread
     * @param gracePeriod How long in-flight attempts may run on after {@link #cancel()}
     * @return Aggregate counts for the batch
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public Report run(List<PipelineRecord> records, AnnotationSchema schema, CompletionListener listener,
                      Duration gracePeriod) throws InterruptedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("An AnnotationScheduler runs a single batch");
        }
        this.schema = schema;
        this.listener = listener == null ? job -> { } : listener;
        this.remaining = new CountDownLatch(records.size());
        this.workers = new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(), namedThreads("annotator-worker"));
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, namedThreads("annotator-backoff"));
        timer.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.backoffTimer = timer;

        List<AnnotationJob> jobs = new ArrayList<>(records.size());
        for (PipelineRecord record : records) {
            jobs.add(new AnnotationJob(record));
        }
        logger.info("Scheduling {} annotation jobs (concurrency={}, {}).", jobs.size(), concurrency, retryPolicy);
        try {
            jobs.forEach(this::submitAttempt);
            while (!remaining.await(POLL_MS, TimeUnit.MILLISECONDS)) {
                if (cancelled.get()) break;
            }
            if (remaining.getCount() > 0) {
                drainAfterCancel(jobs, gracePeriod);
            }
        } finally {
            workers.shutdownNow();
            backoffTimer.shutdownNow();
        }
        Report report = new Report(jobs.size(), annotated.get(), failed.get(), exhausted.get(), abandoned.get(), maxInFlight.get());
        logger.info("Annotation finished: {} annotated, {} failed, {} exhausted, {} cancelled (max {} in flight).",
            report.annotated(), report.failed(), report.exhausted(), report.cancelled(), report.maxInFlight());
        return report;
    }

    /**
     * Stops starting new attempts. Safe to call from any thread, including completion listeners.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.warn("Annotation cancelled; no further attempts will be started.");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private void drainAfterCancel(List<AnnotationJob> jobs, Duration gracePeriod) throws InterruptedException {
        logger.info("Waiting up to {} ms for {} unresolved job(s) to drain.", gracePeriod.toMillis(), remaining.getCount());
        // jobs parked on the backoff timer will never run again
        for (AnnotationJob job : jobs) {
            if (job.state() == JobState.PENDING) abandon(job);
        }
        if (remaining.await(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) return;
        logger.warn("Grace period elapsed with {} job(s) in flight; abandoning them.", remaining.getCount());
        workers.shutdownNow();
        for (AnnotationJob job : jobs) {
            abandon(job);
        }
        workers.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void submitAttempt(AnnotationJob job) {
        if (cancelled.get()) {
            abandon(job);
            return;
        }
        try {
            workers.execute(() -> runAttempt(job));
        } catch (RejectedExecutionException e) {
            abandon(job);
        }
    }

    private void runAttempt(AnnotationJob job) {
        if (cancelled.get()) {
            abandon(job);
            return;
        }
        if (!job.begin()) return;
        PipelineRecord record = job.record();
        record.recordAttempt();
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        logger.debug("Attempt {}/{} for {}", job.attempt(), retryPolicy.maxAttempts(), record.id());

        ValidationResult result = null;
        TransportException transportError = null;
        try {
            String text = annotationService.annotate(promptContext, record.rawPayload(), schema);
            result = parser.parse(text, schema);
        } catch (TransportException e) {
            transportError = e;
        } catch (RuntimeException e) {
            transportError = new TransportException("Unexpected annotation service error: " + e, e);
        } finally {
            inFlight.decrementAndGet();
        }

        if (result != null && result.isValid()) {
            if (job.resolve(JobState.SUCCEEDED)) {
                record.completeAnnotated(result.annotation());
                annotated.incrementAndGet();
                complete(job);
            }
            return;
        }

        String error = result != null ? result.describe() : "TransportError: " + transportError.getMessage();
        boolean retryable = result != null || transportError.isRetryable();
        if (retryable && retryPolicy.hasAttemptsLeft(job.attempt())) {
            record.recordError(error);
            scheduleRetry(job, error);
            return;
        }
        if (result != null) {
            resolveTerminal(job, JobState.FAILED, error);
        } else if (retryable) {
            resolveTerminal(job, JobState.EXHAUSTED, "Exhausted after " + job.attempt() + " attempts; last error: " + error);
        } else {
            resolveTerminal(job, JobState.EXHAUSTED, "Not retryable after attempt " + job.attempt() + "; " + error);
        }
    }

    private void scheduleRetry(AnnotationJob job, String error) {
        if (!job.backOff()) return;
        long delayMs = retryPolicy.delayBeforeAttempt(job.attempt() + 1).toMillis();
        logger.warn("Attempt {} for {} failed, retrying in {} ms: {}", job.attempt(), job.record().id(), delayMs,
            Utils.truncate(error, 300));
        try {
            backoffTimer.schedule(() -> submitAttempt(job), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            abandon(job);
        }
    }

    private void resolveTerminal(AnnotationJob job, JobState terminal, String error) {
        if (!job.resolve(terminal)) return;
        PipelineRecord record = job.record();
        if (terminal == JobState.EXHAUSTED) {
            record.completeExhausted(error);
            exhausted.incrementAndGet();
        } else {
            record.completeFailed(error);
            failed.incrementAndGet();
        }
        logger.warn("Record {} {}: {}", record.id(), record.status(), Utils.truncate(error, 300));
        complete(job);
    }

    private void abandon(AnnotationJob job) {
        if (!job.resolve(JobState.CANCELLED)) return;
        abandoned.incrementAndGet();
        logger.debug("Abandoned job for {} after {} attempt(s).", job.record().id(), job.attempt());
        remaining.countDown();
    }

    private void complete(AnnotationJob job) {
        try {
            listener.onComplete(job);
        } catch (RuntimeException e) {
            logger.error("Completion listener failed for {}: {}", job.record().id(), e.getMessage(), e);
        } finally {
            remaining.countDown();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
