package com.example.series_backend.dto;

import com.example.series_backend.util.ScriptVoteAction;

import java.util.UUID;

public record ScriptVoteResult(
        UUID scriptId,
        ScriptVoteAction action,
        Integer value,
        int voteCount,
        int upvotes,
        int downvotes
) {}
