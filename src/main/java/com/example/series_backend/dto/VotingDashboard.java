package com.example.series_backend.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record VotingDashboard(
        PeriodSummary currentPeriod,
        PeriodSummary upcomingPeriod,
        List<WinnerSummary> recentWinners,
        Stats stats
) {
    public record PeriodSummary(UUID id, Instant startsAt, Instant endsAt, boolean active) {}

    public record WinnerSummary(UUID scriptId, String title, int voteCount, UUID seriesId, Instant producedAt) {}

    public record Stats(long processedPeriods, long scriptsVoted, double averageVotesPerPeriod, long pendingJobs, long processingJobs) {}
}
