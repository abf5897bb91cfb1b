package com.example.series_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-episode snapshot of the winning script, stored on the episode at dispatch time so
 * production never has to read the script again.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EpisodeBrief(
        int episodeNumber,
        String title,
        String seriesTitle,
        String logline,
        String genre,
        String beat,
        String styleBible,
        String camera,
        String scene,
        String motion,
        String narrationText,
        String posterStyle,
        String keyVisual,
        String mood
) {
    public boolean hasNarration() {
        return narrationText != null && !narrationText.isBlank();
    }
}
