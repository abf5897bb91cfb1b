package com.example.series_backend.dto;

import com.example.series_backend.util.ClipVoteAction;

import java.util.UUID;

public record ClipVoteResult(
        ClipVoteAction action,
        UUID episodeId,
        UUID variantId,
        int voteCount,
        UUID previousVariantId
) {}
