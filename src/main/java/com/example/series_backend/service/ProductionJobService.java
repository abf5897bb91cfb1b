package com.example.series_backend.service;

import com.example.series_backend.config.ProductionProperties;
import com.example.series_backend.dto.ClaimedJob;
import com.example.series_backend.model.Episode;
import com.example.series_backend.model.ProductionJob;
import com.example.series_backend.model.Series;
import com.example.series_backend.repository.ProductionJobRepository;
import com.example.series_backend.util.EpisodeStatus;
import com.example.series_backend.util.FailureOutcome;
import com.example.series_backend.util.JobStatus;
import com.example.series_backend.util.JobType;
import com.example.series_backend.util.SeriesStatus;
import com.example.series_backend.util.StuckJobPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queue state transitions for production jobs: selection, claim, completion, failure with
 * backoff and the stuck-job sweep.
 */
@Service
public class ProductionJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProductionJobService.class);

    private final ProductionJobRepository jobRepo;
    private final SeriesStateReconciler reconciler;
    private final ProductionProperties properties;
    private final TransactionTemplate tx;
    private final Clock clock;

    public ProductionJobService(ProductionJobRepository jobRepo, SeriesStateReconciler reconciler,
                                ProductionProperties properties, TransactionTemplate tx, Clock clock) {
        this.jobRepo = jobRepo;
        this.reconciler = reconciler;
        this.properties = properties;
        this.tx = tx;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<UUID> selectDue(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return jobRepo.findDueIds(clock.instant(), PageRequest.of(0, limit));
    }

    /**
     * Moves the job from PENDING to PROCESSING if nobody else did first.
     *
     * @return the claimed job, or empty when another worker won the race.
     */
    @Transactional
    public Optional<ClaimedJob> claim(UUID jobId) {
        if (jobRepo.claim(jobId, clock.instant()) != 1) {
            return Optional.empty();
        }
        ProductionJob job = jobRepo.findById(jobId).orElseThrow();
        return Optional.of(new ClaimedJob(
                job.getId(),
                job.getSeries().getId(),
                job.getEpisode().getId(),
                job.getEpisode().getEpisodeNumber(),
                job.getJobType(),
                job.getAttemptCount(),
                job.getMaxAttempts()));
    }

    /**
     * Hands a claimed job back without counting an attempt, e.g. when the executor refused it.
     */
    @Transactional
    public void releaseClaim(UUID jobId) {
        jobRepo.findById(jobId).ifPresent(job -> {
            if (job.getStatus() == JobStatus.PROCESSING) {
                job.setStatus(JobStatus.PENDING);
                job.setStartedAt(null);
            }
        });
    }

    /**
     * Completes a job the caller still holds.
     *
     * @return false when the job already left PROCESSING, e.g. swept as stuck.
     */
    @Transactional
    public boolean markCompleted(UUID jobId) {
        ProductionJob job = jobRepo.findById(jobId).orElseThrow();
        if (job.getStatus() != JobStatus.PROCESSING) {
            LOGGER.warn("JOB STALE complete ignored jobId={} status={}", jobId, job.getStatus());
            return false;
        }
        job.setStatus(JobStatus.COMPLETED);
        job.setCompletedAt(clock.instant());
        job.setLastError(null);
        return true;
    }

    /**
     * Records a failed attempt. Below the attempt limit the job and its episode go back to
     * PENDING behind an exponential backoff; at the limit the job fails for good. A job that
     * already left PROCESSING is left alone and {@link FailureOutcome#STALE} is returned.
     */
    @Transactional
    public FailureOutcome recordFailure(UUID jobId, String error) {
        ProductionJob job = jobRepo.findById(jobId).orElseThrow();
        if (job.getStatus() != JobStatus.PROCESSING) {
            LOGGER.warn("JOB STALE failure ignored jobId={} status={} error={}", jobId, job.getStatus(), error);
            return FailureOutcome.STALE;
        }
        return applyFailure(job, error, false);
    }

    /**
     * Applies the configured policy to jobs that stayed PROCESSING longer than the threshold.
     *
     * @return number of jobs swept.
     */
    public int sweepStuckJobs() {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(Math.max(1, properties.getStuckJobThresholdMinutes())));
        List<UUID> stuck = jobRepo.findStuckIds(cutoff);
        StuckJobPolicy policy = properties.getStuckJobPolicy() != null ? properties.getStuckJobPolicy() : StuckJobPolicy.FAIL;
        int swept = 0;
        for (UUID id : stuck) {
            UUID seriesId = tx.execute(status -> {
                ProductionJob job = jobRepo.findById(id).orElse(null);
                if (job == null || job.getStatus() != JobStatus.PROCESSING) {
                    return null;
                }
                String error = "STUCK_PROCESSING since " + job.getStartedAt();
                applyFailure(job, error, policy == StuckJobPolicy.FAIL);
                return job.getSeries().getId();
            });
            if (seriesId != null) {
                swept++;
                LOGGER.warn("STUCK JOB swept jobId={} policy={}", id, policy);
                reconciler.reconcile(seriesId);
            }
        }
        return swept;
    }

    private FailureOutcome applyFailure(ProductionJob job, String error, boolean terminal) {
        Instant now = clock.instant();
        int attempt = job.getAttemptCount() + 1;
        job.setAttemptCount(attempt);
        job.setLastError(truncate(error, properties.getLastErrorMaxLength()));
        job.setStartedAt(null);
        Episode episode = job.getEpisode();

        if (!terminal && attempt < job.getMaxAttempts()) {
            Duration delay = backoff(attempt, properties.getMaxBackoffMinutes());
            job.setStatus(JobStatus.PENDING);
            job.setAvailableAt(now.plus(delay));
            if (episode.getStatus() != EpisodeStatus.CLIP_SELECTED) {
                episode.setStatus(EpisodeStatus.PENDING);
            }
            LOGGER.warn("JOB RETRY jobId={} type={} attempt={}/{} in={}s error={}",
                    job.getId(), job.getJobType(), attempt, job.getMaxAttempts(), delay.toSeconds(), job.getLastError());
            return FailureOutcome.RETRIED;
        }

        job.setStatus(JobStatus.FAILED);
        job.setCompletedAt(now);
        episode.setStatus(EpisodeStatus.FAILED);
        if (job.getJobType() == JobType.PILOT_VARIANTS) {
            Series series = job.getSeries();
            series.setStatus(SeriesStatus.FAILED);
        }
        LOGGER.error("JOB FAILED jobId={} type={} attempts={} episodeId={} error={}",
                job.getId(), job.getJobType(), attempt, episode.getId(), job.getLastError());
        return FailureOutcome.FAILED;
    }

    /**
     * {@code min(cap, 2^(attempt-1))} minutes.
     */
    static Duration backoff(int attempt, int maxMinutes) {
        int exp = Math.max(0, Math.min(attempt - 1, 20));
        long minutes = Math.min(Math.max(1, maxMinutes), 1L << exp);
        return Duration.ofMinutes(minutes);
    }

    static String truncate(String s, int max) {
        if (s == null) return null;
        int limit = Math.max(16, max);
        return s.length() <= limit ? s : s.substring(0, limit);
    }
}
