package com.example.series_backend.util;

public enum FailureOutcome {
    RETRIED,
    FAILED,
    /** The job had already left PROCESSING; nothing was recorded. */
    STALE
}
