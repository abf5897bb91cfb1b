package com.example.series_backend.service;

import com.example.series_backend.dto.SeriesView;
import com.example.series_backend.model.Episode;
import com.example.series_backend.model.ProductionJob;
import com.example.series_backend.model.Series;
import com.example.series_backend.repository.EpisodeRepository;
import com.example.series_backend.repository.ProductionJobRepository;
import com.example.series_backend.repository.SeriesRepository;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class SeriesQueryService {

    private final SeriesRepository seriesRepo;
    private final EpisodeRepository episodeRepo;
    private final ProductionJobRepository jobRepo;

    public SeriesQueryService(SeriesRepository seriesRepo, EpisodeRepository episodeRepo, ProductionJobRepository jobRepo) {
        this.seriesRepo = seriesRepo;
        this.episodeRepo = episodeRepo;
        this.jobRepo = jobRepo;
    }

    @Transactional(readOnly = true)
    public SeriesView get(UUID seriesId) {
        Series series = seriesRepo.findById(seriesId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SERIES_NOT_FOUND"));
        Map<UUID, ProductionJob> jobsByEpisode = jobRepo.findBySeriesId(seriesId).stream()
                .collect(Collectors.toMap(j -> j.getEpisode().getId(), Function.identity(), (a, b) -> a));
        List<SeriesView.EpisodeView> episodes = episodeRepo.findBySeriesIdOrderByEpisodeNumberAsc(seriesId).stream()
                .map(e -> view(e, jobsByEpisode.get(e.getId())))
                .toList();
        return new SeriesView(series.getId(), series.getScriptId(), series.getTitle(), series.getStatus(),
                series.getEpisodeCount(), series.getCompletedAt(), episodes);
    }

    private static SeriesView.EpisodeView view(Episode e, ProductionJob job) {
        return new SeriesView.EpisodeView(
                e.getId(), e.getEpisodeNumber(), e.getTitle(), e.getStatus(), e.getVideoUrl(), e.getTtsAudioUrl(),
                e.getClipVotingEndsAt(),
                job != null ? job.getStatus() : null,
                job != null ? job.getAttemptCount() : 0,
                job != null ? job.getLastError() : null);
    }
}
