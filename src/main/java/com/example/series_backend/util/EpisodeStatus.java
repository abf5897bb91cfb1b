package com.example.series_backend.util;

public enum EpisodeStatus {
    PENDING, GENERATING, CLIP_VOTING, CLIP_SELECTED, FAILED
}
