package com.example.series_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ScriptVoteRequest(
        @NotBlank @Size(max = 128) String voterId,
        @NotNull Integer value
) {}
