package com.example.series_backend.service;

import com.example.series_backend.model.Episode;
import com.example.series_backend.model.ProductionJob;
import com.example.series_backend.model.Series;
import com.example.series_backend.repository.EpisodeRepository;
import com.example.series_backend.repository.ProductionJobRepository;
import com.example.series_backend.repository.SeriesRepository;
import com.example.series_backend.util.EpisodeStatus;
import com.example.series_backend.util.JobType;
import com.example.series_backend.util.SeriesStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@DataJpaTest
@Import({SeriesStateReconciler.class, ServiceTestConfig.class})
class SeriesStateReconcilerTest {

    @Autowired private SeriesStateReconciler reconciler;
    @Autowired private SeriesRepository seriesRepo;
    @Autowired private EpisodeRepository episodeRepo;
    @Autowired private ProductionJobRepository jobRepo;
    @Autowired private MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(ServiceTestConfig.NOW);
    }

    @Test
    void fivePlayableEpisodesCompleteTheSeriesOnce() {
        Series series = series(SeriesStatus.ACTIVE);
        for (int n = 1; n <= 5; n++) {
            episode(series, n, EpisodeStatus.CLIP_SELECTED, "https://cdn.example.com/" + n + ".mp4");
        }

        assertEquals(SeriesStatus.COMPLETED, reconciler.reconcile(series.getId()));
        clock.advance(Duration.ofHours(3));
        reconciler.reconcile(series.getId());

        Series done = seriesRepo.findById(series.getId()).orElseThrow();
        assertEquals(SeriesStatus.COMPLETED, done.getStatus());
        assertEquals(5, done.getEpisodeCount());
        assertEquals(ServiceTestConfig.NOW, done.getCompletedAt());
    }

    @Test
    void somePlayableEpisodesMakeTheSeriesActive() {
        Series series = series(SeriesStatus.PRODUCING);
        episode(series, 1, EpisodeStatus.CLIP_SELECTED, "https://cdn.example.com/1.mp4");
        episode(series, 2, EpisodeStatus.CLIP_SELECTED, "https://cdn.example.com/2.mp4");
        episode(series, 3, EpisodeStatus.GENERATING, null);

        assertEquals(SeriesStatus.ACTIVE, reconciler.reconcile(series.getId()));
        assertEquals(2, seriesRepo.findById(series.getId()).orElseThrow().getEpisodeCount());
    }

    @Test
    void playableFollowUpsWithoutPilotDoNotComplete() {
        Series series = series(SeriesStatus.ACTIVE);
        episode(series, 1, EpisodeStatus.CLIP_VOTING, null);
        for (int n = 2; n <= 6; n++) {
            episode(series, n, EpisodeStatus.CLIP_SELECTED, "https://cdn.example.com/" + n + ".mp4");
        }

        assertEquals(SeriesStatus.ACTIVE, reconciler.reconcile(series.getId()));
        assertNull(seriesRepo.findById(series.getId()).orElseThrow().getCompletedAt());
    }

    @Test
    void failedSeriesStaysFailed() {
        Series series = series(SeriesStatus.FAILED);
        episode(series, 2, EpisodeStatus.CLIP_SELECTED, "https://cdn.example.com/2.mp4");

        assertEquals(SeriesStatus.FAILED, reconciler.reconcile(series.getId()));
    }

    @Test
    void pendingWorkKeepsTheSeriesProducing() {
        Series series = series(SeriesStatus.PENDING);
        Episode pilot = episode(series, 1, EpisodeStatus.PENDING, null);
        ProductionJob job = new ProductionJob(series, pilot, JobType.PILOT_VARIANTS);
        job.setAvailableAt(ServiceTestConfig.NOW);
        jobRepo.saveAndFlush(job);

        assertEquals(SeriesStatus.PRODUCING, reconciler.reconcile(series.getId()));
    }

    @Test
    void inFlightSweepVisitsProducingAndActiveSeries() {
        series(SeriesStatus.PRODUCING);
        series(SeriesStatus.ACTIVE);
        series(SeriesStatus.COMPLETED);
        series(SeriesStatus.FAILED);

        assertEquals(2, reconciler.reconcileInFlight(20));
    }

    private Series series(SeriesStatus status) {
        Series series = new Series(UUID.randomUUID(), "Salt Lines");
        series.setStatus(status);
        return seriesRepo.saveAndFlush(series);
    }

    private Episode episode(Series series, int n, EpisodeStatus status, String videoUrl) {
        Episode episode = new Episode(series, n, "Episode " + n);
        episode.setStatus(status);
        episode.setVideoUrl(videoUrl);
        return episodeRepo.saveAndFlush(episode);
    }
}
