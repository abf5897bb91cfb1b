package com.example.series_backend.service;

import com.example.series_backend.config.ProductionProperties;
import com.example.series_backend.dto.EnqueueResult;
import com.example.series_backend.dto.ScriptData;
import com.example.series_backend.model.Episode;
import com.example.series_backend.model.ProductionJob;
import com.example.series_backend.model.Script;
import com.example.series_backend.model.Series;
import com.example.series_backend.repository.EpisodeRepository;
import com.example.series_backend.repository.ProductionJobRepository;
import com.example.series_backend.repository.ScriptRepository;
import com.example.series_backend.repository.SeriesRepository;
import com.example.series_backend.util.JobType;
import com.example.series_backend.util.ScriptStatus;
import com.example.series_backend.util.SeriesStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Expands a winning script into a series of episodes with one production job each. Every row is
 * looked up before it is created, so repeated calls only fill in what is missing.
 */
@Service
public class ProductionDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProductionDispatcher.class);

    private final ScriptRepository scriptRepo;
    private final SeriesRepository seriesRepo;
    private final EpisodeRepository episodeRepo;
    private final ProductionJobRepository jobRepo;
    private final ScriptDataCodec codec;
    private final ProductionProperties properties;
    private final Clock clock;

    public ProductionDispatcher(ScriptRepository scriptRepo, SeriesRepository seriesRepo, EpisodeRepository episodeRepo,
                                ProductionJobRepository jobRepo, ScriptDataCodec codec, ProductionProperties properties, Clock clock) {
        this.scriptRepo = scriptRepo;
        this.seriesRepo = seriesRepo;
        this.episodeRepo = episodeRepo;
        this.jobRepo = jobRepo;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public EnqueueResult enqueueBatch(UUID scriptId) {
        Script script = scriptRepo.findById(scriptId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SCRIPT_NOT_FOUND"));
        if (script.getStatus() != ScriptStatus.SELECTED && script.getStatus() != ScriptStatus.PRODUCED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "SCRIPT_NOT_SELECTED");
        }
        Instant now = clock.instant();
        ScriptData data = codec.read(script.getScriptData(), script.getTitle(), script.getLogline(), script.getGenre());

        boolean createdSeries = false;
        Series series = seriesRepo.findByScriptId(scriptId).orElse(null);
        if (series == null) {
            series = new Series(scriptId, data.title());
            series.setStudioId(script.getStudioId());
            series.setLogline(data.logline());
            series.setGenre(data.genre());
            series.setSeriesBible(codec.write(data.seriesBible()));
            series.setPosterSpec(codec.write(data.posterSpec()));
            series = seriesRepo.save(series);
            createdSeries = true;
        }

        int createdEpisodes = 0;
        int enqueuedJobs = 0;
        for (int n = 1; n <= properties.getEpisodesPerSeries(); n++) {
            Episode episode = episodeRepo.findBySeriesIdAndEpisodeNumber(series.getId(), n).orElse(null);
            if (episode == null) {
                String title = n == 1 ? data.title() + " - Pilot" : data.title() + " - Episode " + n;
                episode = new Episode(series, n, title);
                episode.setBrief(codec.writeBrief(codec.briefFor(data, series.getTitle(), n, title)));
                episode = episodeRepo.save(episode);
                createdEpisodes++;
            }

            JobType type = n == 1 ? JobType.PILOT_VARIANTS : JobType.SINGLE_EPISODE;
            if (jobRepo.findByEpisodeIdAndJobType(episode.getId(), type).isEmpty()) {
                ProductionJob job = new ProductionJob(series, episode, type);
                job.setPriority(n == 1 ? properties.getPilotPriority() : properties.getEpisodePriority());
                job.setMaxAttempts(Math.max(1, properties.getMaxAttempts()));
                job.setAvailableAt(now);
                jobRepo.save(job);
                enqueuedJobs++;
            }
        }

        if (enqueuedJobs > 0 && series.getStatus() != SeriesStatus.FAILED && series.getStatus() != SeriesStatus.COMPLETED) {
            series.setStatus(SeriesStatus.PRODUCING);
        }
        if (script.getStatus() != ScriptStatus.PRODUCED) {
            script.setStatus(ScriptStatus.PRODUCED);
            script.setProducedAt(now);
        }
        script.setSeriesId(series.getId());

        LOGGER.info("DISPATCH scriptId={} seriesId={} createdSeries={} episodes={} jobs={}",
                scriptId, series.getId(), createdSeries, createdEpisodes, enqueuedJobs);
        return new EnqueueResult(series.getId(), createdSeries, createdEpisodes, enqueuedJobs);
    }
}
