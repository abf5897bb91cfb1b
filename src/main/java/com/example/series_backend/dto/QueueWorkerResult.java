package com.example.series_backend.dto;

public record QueueWorkerResult(
        int processed,
        int completed,
        int retried,
        int failed,
        int skippedJobs,
        boolean skipped
) {
    public static QueueWorkerResult notConfigured() {
        return new QueueWorkerResult(0, 0, 0, 0, 0, true);
    }
}
