package com.example.series_backend.dto;

import com.example.series_backend.util.FinalizeStatus;

import java.util.UUID;

public record FinalizeResult(UUID episodeId, FinalizeStatus status, String reason, String videoUrl, String key) {

    public static FinalizeResult skipped(UUID episodeId, String reason) {
        return new FinalizeResult(episodeId, FinalizeStatus.SKIPPED, reason, null, null);
    }

    public static FinalizeResult completed(UUID episodeId, String videoUrl, String key) {
        return new FinalizeResult(episodeId, FinalizeStatus.COMPLETED, null, videoUrl, key);
    }
}
