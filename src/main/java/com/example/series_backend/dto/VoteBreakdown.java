package com.example.series_backend.dto;

import java.util.UUID;

public record VoteBreakdown(UUID scriptId, int voteCount, int upvotes, int downvotes, long voters) {}
