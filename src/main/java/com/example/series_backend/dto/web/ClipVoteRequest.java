package com.example.series_backend.dto.web;

import com.example.series_backend.util.VoterKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ClipVoteRequest(
        @NotNull VoterKind voterKind,
        @NotBlank @Size(max = 128) String voterId
) {}
