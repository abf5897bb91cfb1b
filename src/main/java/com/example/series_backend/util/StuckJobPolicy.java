package com.example.series_backend.util;

/**
 * What the stuck-job sweep does with a job that stayed {@link JobStatus#PROCESSING} too long.
 */
public enum StuckJobPolicy {
    /** Terminal failure, propagated to the episode or series like an exhausted job. */
    FAIL,
    /** Counted as one failed attempt; the normal backoff and attempt limit apply. */
    RETRY
}
