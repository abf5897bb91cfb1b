package com.example.series_backend.dto;

import com.example.series_backend.util.EpisodeStatus;
import com.example.series_backend.util.JobStatus;
import com.example.series_backend.util.SeriesStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record SeriesView(
        UUID id,
        UUID scriptId,
        String title,
        SeriesStatus status,
        int episodeCount,
        Instant completedAt,
        List<EpisodeView> episodes
) {
    public record EpisodeView(
            UUID id,
            int episodeNumber,
            String title,
            EpisodeStatus status,
            String videoUrl,
            String ttsAudioUrl,
            Instant clipVotingEndsAt,
            JobStatus jobStatus,
            int attemptCount,
            String lastError
    ) {}
}
