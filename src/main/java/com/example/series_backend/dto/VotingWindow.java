package com.example.series_backend.dto;

import java.time.Instant;

public record VotingWindow(Instant startsAt, Instant endsAt) {}
