package com.example.series_backend.util;

public enum PeriodKind {
    SCRIPT_VOTING,
    /** Kept for rows written before clip voting moved onto episodes. Never scheduled. */
    CLIP_VOTING
}
