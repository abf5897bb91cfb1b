package com.example.series_backend.service;

import com.example.series_backend.config.TickProperties;
import com.example.series_backend.dto.QueueWorkerResult;
import com.example.series_backend.dto.TickResult;
import com.example.series_backend.dto.VotingPeriodResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * One pass over the whole pipeline. A failing step is logged and recorded in the result; the
 * remaining steps still run.
 */
@Service
public class VotingTickService {
    private static final Logger LOGGER = LoggerFactory.getLogger(VotingTickService.class);

    private final VotingScheduler scheduler;
    private final ProductionJobService jobService;
    private final ProductionWorker worker;
    private final ClipBallotBox clipBallotBox;
    private final EpisodeFinalizer finalizer;
    private final SeriesStateReconciler reconciler;
    private final TickProperties properties;

    public VotingTickService(VotingScheduler scheduler, ProductionJobService jobService, ProductionWorker worker,
                             ClipBallotBox clipBallotBox, EpisodeFinalizer finalizer,
                             SeriesStateReconciler reconciler, TickProperties properties) {
        this.scheduler = scheduler;
        this.jobService = jobService;
        this.worker = worker;
        this.clipBallotBox = clipBallotBox;
        this.finalizer = finalizer;
        this.reconciler = reconciler;
        this.properties = properties;
    }

    public TickResult tick() {
        long t0 = System.nanoTime();
        List<String> errors = new ArrayList<>();

        int opened = step("openDuePeriods", errors, scheduler::openDuePeriods, 0);
        List<VotingPeriodResult> closed = step("closeDuePeriods", errors, scheduler::closeDuePeriods, List.of());
        boolean created = step("ensureUpcomingPeriod", errors, scheduler::ensureUpcomingPeriod, false);
        int swept = step("sweepStuckJobs", errors, jobService::sweepStuckJobs, 0);
        QueueWorkerResult queue = step("processQueuedJobs", errors, worker::processQueuedJobs, null);
        int clipsClosed = step("closeExpiredClipVoting", errors, clipBallotBox::closeExpiredClipVoting, 0);
        int finalized = step("finalizePending", errors, () -> finalizer.finalizePending(properties.getFinalizeBatchSize()), 0);
        int reconciled = step("reconcileInFlight", errors, () -> reconciler.reconcileInFlight(properties.getReconcileBatchSize()), 0);

        TickResult result = new TickResult(opened, closed, created, swept, queue, clipsClosed, finalized, reconciled, List.copyOf(errors));
        LOGGER.info("TICK opened={} closed={} upcomingCreated={} swept={} jobs={} clipsClosed={} finalized={} reconciled={} errors={} in={}ms",
                opened, closed.size(), created, swept, queue != null ? queue.processed() : 0, clipsClosed, finalized,
                reconciled, errors.size(), (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    private static <T> T step(String name, List<String> errors, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            LOGGER.error("TICK STEP FAIL step={} err={}", name, e.toString(), e);
            errors.add(name + ": " + e.getMessage());
            return fallback;
        }
    }
}
