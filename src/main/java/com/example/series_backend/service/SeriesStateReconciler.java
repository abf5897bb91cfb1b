package com.example.series_backend.service;

import com.example.series_backend.config.ProductionProperties;
import com.example.series_backend.model.Episode;
import com.example.series_backend.model.ProductionJob;
import com.example.series_backend.model.Series;
import com.example.series_backend.repository.EpisodeRepository;
import com.example.series_backend.repository.ProductionJobRepository;
import com.example.series_backend.repository.SeriesRepository;
import com.example.series_backend.util.JobStatus;
import com.example.series_backend.util.SeriesStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Derives a series status from its episodes and jobs. Idempotent; safe to call after any change.
 */
@Service
public class SeriesStateReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(SeriesStateReconciler.class);

    private final SeriesRepository seriesRepo;
    private final EpisodeRepository episodeRepo;
    private final ProductionJobRepository jobRepo;
    private final ProductionProperties properties;
    private final TransactionTemplate tx;
    private final Clock clock;

    public SeriesStateReconciler(SeriesRepository seriesRepo, EpisodeRepository episodeRepo,
                                 ProductionJobRepository jobRepo, ProductionProperties properties,
                                 TransactionTemplate tx, Clock clock) {
        this.seriesRepo = seriesRepo;
        this.episodeRepo = episodeRepo;
        this.jobRepo = jobRepo;
        this.properties = properties;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * @return the status after reconciliation, or null if the series does not exist.
     */
    public SeriesStatus reconcile(UUID seriesId) {
        return tx.execute(status -> {
            Series series = seriesRepo.findById(seriesId).orElse(null);
            if (series == null) {
                return null;
            }
            if (series.getStatus() == SeriesStatus.FAILED) {
                return SeriesStatus.FAILED;
            }
            SeriesStatus before = series.getStatus();
            List<Episode> episodes = episodeRepo.findBySeriesIdOrderByEpisodeNumberAsc(seriesId);
            int target = Math.max(1, properties.getEpisodesPerSeries());
            int playable = (int) episodes.stream().filter(Episode::isPlayable).count();
            boolean pilotPlayable = episodes.stream().anyMatch(e -> e.getEpisodeNumber() == 1 && e.isPlayable());

            if (pilotPlayable && playable >= target) {
                series.setStatus(SeriesStatus.COMPLETED);
                series.setEpisodeCount(target);
                if (series.getCompletedAt() == null) {
                    series.setCompletedAt(clock.instant());
                }
            } else if (playable > 0) {
                series.setStatus(SeriesStatus.ACTIVE);
                series.setEpisodeCount(playable);
            } else {
                boolean busy = jobRepo.findBySeriesId(seriesId).stream()
                        .map(ProductionJob::getStatus)
                        .anyMatch(s -> s == JobStatus.PENDING || s == JobStatus.PROCESSING);
                if (busy || before != SeriesStatus.PRODUCING) {
                    series.setStatus(SeriesStatus.PRODUCING);
                }
            }
            if (before != series.getStatus()) {
                LOGGER.info("SERIES STATUS seriesId={} {} -> {} playable={}", seriesId, before, series.getStatus(), playable);
            }
            return series.getStatus();
        });
    }

    /**
     * Reconciles the least recently touched PRODUCING and ACTIVE series.
     *
     * @return number of series visited.
     */
    public int reconcileInFlight(int limit) {
        if (limit <= 0) {
            return 0;
        }
        List<UUID> ids = seriesRepo.findByStatusInOrderByUpdatedAtAsc(
                        List.of(SeriesStatus.PRODUCING, SeriesStatus.ACTIVE), PageRequest.of(0, limit))
                .stream().map(Series::getId).toList();
        int visited = 0;
        for (UUID id : ids) {
            try {
                reconcile(id);
                visited++;
            } catch (RuntimeException e) {
                LOGGER.warn("SERIES RECONCILE FAIL seriesId={} err={}", id, e.toString());
            }
        }
        return visited;
    }
}
