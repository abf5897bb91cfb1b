package com.example.series_backend.dto;

import com.example.series_backend.util.JobType;

import java.util.UUID;

/**
 * Detached view of a job this worker owns. Handlers only ever see this, never the entity.
 */
public record ClaimedJob(
        UUID jobId,
        UUID seriesId,
        UUID episodeId,
        int episodeNumber,
        JobType jobType,
        int attemptCount,
        int maxAttempts
) {}
