package com.example.series_backend.service;

import com.example.series_backend.config.WorkerExecutorProperties;
import com.example.series_backend.dto.ClaimedJob;
import com.example.series_backend.dto.QueueWorkerResult;
import com.example.series_backend.engine.Interfaces.VideoGenerator;
import com.example.series_backend.service.Interfaces.ObjectStore;
import com.example.series_backend.service.handler.ProductionJobHandler;
import com.example.series_backend.util.FailureOutcome;
import com.example.series_backend.util.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drains due production jobs within a job and time budget. Claims are atomic, so several
 * workers may drain concurrently without running a job twice.
 */
@Service
public class ProductionWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProductionWorker.class);

    static final int MAX_JOBS_CAP = 50;
    static final Duration MIN_RUNTIME = Duration.ofSeconds(1);
    static final Duration MAX_RUNTIME = Duration.ofSeconds(120);

    private final ProductionJobService jobService;
    private final SeriesStateReconciler reconciler;
    private final VideoGenerator generator;
    private final ObjectStore store;
    private final Map<JobType, ProductionJobHandler> handlers = new EnumMap<>(JobType.class);
    private final Executor workerExecutor;
    private final WorkerExecutorProperties workerProperties;
    private final Semaphore slots;

    public ProductionWorker(ProductionJobService jobService, SeriesStateReconciler reconciler,
                            @Nullable VideoGenerator generator, @Nullable ObjectStore store,
                            List<ProductionJobHandler> handlers,
                            @Qualifier("workerTaskExecutor") Executor workerExecutor,
                            WorkerExecutorProperties workerProperties) {
        this.jobService = jobService;
        this.reconciler = reconciler;
        this.generator = generator;
        this.store = store;
        for (ProductionJobHandler h : handlers) {
            this.handlers.put(h.handlesType(), h);
        }
        this.workerExecutor = workerExecutor;
        this.workerProperties = workerProperties;
        this.slots = new Semaphore(Math.max(1, workerProperties.getMaxConcurrency()));
    }

    /**
     * Drains with the configured per-tick budget.
     */
    public QueueWorkerResult processQueuedJobs() {
        return processQueuedJobs(workerProperties.getMaxJobsPerTick(),
                Duration.ofSeconds(workerProperties.getMaxRuntimeSeconds()));
    }

    /**
     * Claims and runs up to {@code maxJobs} due jobs. No new job is claimed once {@code maxRuntime}
     * has passed; jobs already running are awaited.
     */
    public QueueWorkerResult processQueuedJobs(int maxJobs, Duration maxRuntime) {
        if (generator == null || store == null) {
            LOGGER.debug("Production worker skipped: generator or storage not configured");
            return QueueWorkerResult.notConfigured();
        }
        int limit = Math.max(1, Math.min(MAX_JOBS_CAP, maxJobs));
        Duration runtime = clamp(maxRuntime);
        long deadline = System.nanoTime() + runtime.toNanos();

        AtomicInteger completed = new AtomicInteger();
        AtomicInteger retried = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        int processed = 0;
        int skipped = 0;
        List<CompletableFuture<Void>> running = new ArrayList<>();

        for (UUID jobId : jobService.selectDue(limit)) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            boolean acquired;
            try {
                acquired = slots.tryAcquire(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!acquired) {
                break;
            }
            Optional<ClaimedJob> claim;
            try {
                claim = jobService.claim(jobId);
            } catch (RuntimeException e) {
                slots.release();
                LOGGER.warn("JOB CLAIM FAIL jobId={} err={}", jobId, e.toString());
                skipped++;
                continue;
            }
            if (claim.isEmpty()) {
                slots.release();
                skipped++;
                continue;
            }
            ClaimedJob job = claim.get();
            try {
                running.add(CompletableFuture.runAsync(() -> run(job, completed, retried, failed), workerExecutor));
                processed++;
            } catch (RejectedExecutionException e) {
                slots.release();
                jobService.releaseClaim(job.jobId());
                LOGGER.warn("JOB REJECTED jobId={} executor saturated", job.jobId());
                skipped++;
            }
        }

        CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).join();
        QueueWorkerResult result = new QueueWorkerResult(processed, completed.get(), retried.get(), failed.get(), skipped, false);
        if (processed > 0 || skipped > 0) {
            LOGGER.info("QUEUE DRAIN processed={} completed={} retried={} failed={} skipped={}",
                    processed, result.completed(), result.retried(), result.failed(), skipped);
        }
        return result;
    }

    private void run(ClaimedJob job, AtomicInteger completed, AtomicInteger retried, AtomicInteger failed) {
        long t0 = System.nanoTime();
        try {
            ProductionJobHandler handler = handlers.get(job.jobType());
            LOGGER.info("JOB START jobId={} type={} episodeId={} attempt={}/{}",
                    job.jobId(), job.jobType(), job.episodeId(), job.attemptCount() + 1, job.maxAttempts());
            try {
                if (handler == null) {
                    throw new IllegalStateException("No handler for job type " + job.jobType());
                }
                handler.execute(job);
                if (jobService.markCompleted(job.jobId())) {
                    completed.incrementAndGet();
                    LOGGER.info("JOB DONE jobId={} type={} in={}ms", job.jobId(), job.jobType(), (System.nanoTime() - t0) / 1_000_000);
                } else {
                    LOGGER.warn("JOB STALE jobId={} type={} finished after losing its claim", job.jobId(), job.jobType());
                }
            } catch (RuntimeException e) {
                LOGGER.error("Job {} failed: {}", job.jobId(), e.toString(), e);
                FailureOutcome outcome = jobService.recordFailure(job.jobId(), String.valueOf(e.getMessage()));
                if (outcome == FailureOutcome.RETRIED) {
                    retried.incrementAndGet();
                } else if (outcome == FailureOutcome.FAILED) {
                    failed.incrementAndGet();
                }
            }
            try {
                reconciler.reconcile(job.seriesId());
            } catch (RuntimeException e) {
                LOGGER.warn("SERIES RECONCILE FAIL seriesId={} err={}", job.seriesId(), e.toString());
            }
        } catch (RuntimeException e) {
            LOGGER.error("JOB BOOKKEEPING FAIL jobId={} err={}", job.jobId(), e.toString(), e);
            failed.incrementAndGet();
        } finally {
            slots.release();
        }
    }

    static Duration clamp(Duration runtime) {
        if (runtime == null || runtime.compareTo(MIN_RUNTIME) < 0) {
            return MIN_RUNTIME;
        }
        return runtime.compareTo(MAX_RUNTIME) > 0 ? MAX_RUNTIME : runtime;
    }
}
