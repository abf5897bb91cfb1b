package com.example.series_backend.dto;

import java.util.List;

public record TickResult(
        int openedPeriods,
        List<VotingPeriodResult> closedPeriods,
        boolean createdUpcomingPeriod,
        int stuckJobsSwept,
        QueueWorkerResult queue,
        int clipVotingClosed,
        int episodesFinalized,
        int seriesReconciled,
        List<String> errors
) {}
