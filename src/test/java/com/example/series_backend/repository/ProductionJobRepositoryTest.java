package com.example.series_backend.repository;

import com.example.series_backend.model.Episode;
import com.example.series_backend.model.ProductionJob;
import com.example.series_backend.model.Series;
import com.example.series_backend.util.JobStatus;
import com.example.series_backend.util.JobType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class ProductionJobRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-05T12:00:00Z");

    @Autowired private ProductionJobRepository jobRepo;
    @Autowired private SeriesRepository seriesRepo;
    @Autowired private EpisodeRepository episodeRepo;
    @Autowired private PlatformTransactionManager txManager;

    @Test
    void secondClaimOfTheSameJobLoses() {
        Series series = seriesRepo.saveAndFlush(new Series(UUID.randomUUID(), "Salt Lines"));
        UUID jobId = job(series, 1, JobType.PILOT_VARIANTS, 100, NOW).getId();

        assertEquals(1, jobRepo.claim(jobId, NOW));
        assertEquals(0, jobRepo.claim(jobId, NOW));

        ProductionJob claimed = jobRepo.findById(jobId).orElseThrow();
        assertEquals(JobStatus.PROCESSING, claimed.getStatus());
        assertEquals(NOW, claimed.getStartedAt());
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void concurrentClaimsOnTwoThreadsHaveExactlyOneWinner() throws Exception {
        Series series = seriesRepo.saveAndFlush(new Series(UUID.randomUUID(), "Salt Lines"));
        ProductionJob job = job(series, 1, JobType.PILOT_VARIANTS, 100, NOW);
        TransactionTemplate tx = new TransactionTemplate(txManager);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch ready = new CountDownLatch(2);
            CountDownLatch go = new CountDownLatch(1);
            Callable<Integer> claimer = () -> {
                ready.countDown();
                go.await(2, TimeUnit.SECONDS);
                return tx.execute(status -> jobRepo.claim(job.getId(), NOW));
            };
            Future<Integer> first = pool.submit(claimer);
            Future<Integer> second = pool.submit(claimer);

            assertTrue(ready.await(2, TimeUnit.SECONDS));
            go.countDown();

            List<Integer> results = List.of(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));
            assertThat(results).containsExactlyInAnyOrder(1, 0);
            assertEquals(JobStatus.PROCESSING, jobRepo.findById(job.getId()).orElseThrow().getStatus());
        } finally {
            pool.shutdownNow();
            jobRepo.deleteById(job.getId());
            episodeRepo.deleteById(job.getEpisode().getId());
            seriesRepo.deleteById(series.getId());
        }
    }

    @Test
    void duplicateJobForEpisodeAndTypeTriggersUniqueViolation() {
        Series series = seriesRepo.saveAndFlush(new Series(UUID.randomUUID(), "Salt Lines"));
        ProductionJob first = job(series, 1, JobType.PILOT_VARIANTS, 100, NOW);

        ProductionJob duplicate = new ProductionJob(series, first.getEpisode(), JobType.PILOT_VARIANTS);

        assertThrows(DataIntegrityViolationException.class, () -> jobRepo.saveAndFlush(duplicate));
    }

    @Test
    void dueJobsComeByPriorityThenAvailability() {
        Series series = seriesRepo.saveAndFlush(new Series(UUID.randomUUID(), "Salt Lines"));
        UUID lowEarly = job(series, 2, JobType.SINGLE_EPISODE, 50, NOW.minus(Duration.ofMinutes(10))).getId();
        UUID lowLate = job(series, 3, JobType.SINGLE_EPISODE, 50, NOW.minus(Duration.ofMinutes(1))).getId();
        UUID pilot = job(series, 1, JobType.PILOT_VARIANTS, 100, NOW).getId();
        job(series, 4, JobType.SINGLE_EPISODE, 50, NOW.plus(Duration.ofMinutes(5)));

        List<UUID> due = jobRepo.findDueIds(NOW, PageRequest.of(0, 10));

        assertThat(due).containsExactly(pilot, lowEarly, lowLate);
    }

    @Test
    void stuckJobsAreThoseProcessingSinceBeforeTheCutoff() {
        Series series = seriesRepo.saveAndFlush(new Series(UUID.randomUUID(), "Salt Lines"));
        UUID old = job(series, 1, JobType.PILOT_VARIANTS, 100, NOW).getId();
        UUID fresh = job(series, 2, JobType.SINGLE_EPISODE, 50, NOW).getId();
        jobRepo.claim(old, NOW.minus(Duration.ofHours(1)));
        jobRepo.claim(fresh, NOW.minus(Duration.ofMinutes(5)));

        assertThat(jobRepo.findStuckIds(NOW.minus(Duration.ofMinutes(30)))).containsExactly(old);
    }

    private ProductionJob job(Series series, int episodeNumber, JobType type, int priority, Instant availableAt) {
        Episode episode = episodeRepo.saveAndFlush(new Episode(series, episodeNumber, "Episode " + episodeNumber));
        ProductionJob job = new ProductionJob(series, episode, type);
        job.setPriority(priority);
        job.setAvailableAt(availableAt);
        return jobRepo.saveAndFlush(job);
    }
}
