package com.example.series_backend.dto;

import java.util.List;
import java.util.UUID;

public record PeriodTally(UUID periodId, UUID winnerScriptId, List<RankedScript> ranked, long totalVotes) {

    public record RankedScript(UUID scriptId, String title, int voteCount, int upvotes, int downvotes) {}

    public boolean hasWinner() {
        return winnerScriptId != null;
    }
}
