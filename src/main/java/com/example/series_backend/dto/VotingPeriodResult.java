package com.example.series_backend.dto;

import java.util.UUID;

public record VotingPeriodResult(
        UUID periodId,
        UUID winnerScriptId,
        UUID seriesId,
        int scriptsTallied,
        String error
) {}
