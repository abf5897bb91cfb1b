package com.example.series_backend.dto;

import com.example.series_backend.util.EpisodeStatus;

import java.util.UUID;

/**
 * Everything a production handler needs about one episode, read inside a single transaction.
 */
public record EpisodeContext(
        UUID episodeId,
        UUID seriesId,
        int episodeNumber,
        EpisodeStatus status,
        String videoUrl,
        String ttsAudioUrl,
        EpisodeBrief brief
) {
    public boolean alreadySelected() {
        return status == EpisodeStatus.CLIP_SELECTED && videoUrl != null;
    }
}
