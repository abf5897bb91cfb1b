package com.example.series_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Partial update of the voting schedule. Null fields keep their current value; numeric values
 * are clamped to their allowed ranges.
 */
public record VotingConfigPatchRequest(
        String cadence,
        Integer scriptVotingDurationMinutes,
        Integer clipVotingDurationMinutes,
        Integer startDayOfWeek,
        Integer startHourUtc,
        Integer immediateStartDelaySeconds,
        Integer minScriptsForVoting,
        @NotBlank @Size(max = 128) String updatedBy
) {}
