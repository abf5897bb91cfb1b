package com.example.series_backend.dto;

import com.example.series_backend.util.VotingCadence;

import java.time.Instant;

/**
 * Effective voting schedule. Day of week uses 0 for Sunday through 6 for Saturday.
 */
public record VotingRuntimeConfig(
        VotingCadence cadence,
        int scriptVotingDurationMinutes,
        int clipVotingDurationMinutes,
        int startDayOfWeek,
        int startHourUtc,
        int immediateStartDelaySeconds,
        int minScriptsForVoting,
        Instant updatedAt,
        String updatedBy
) {}
