package com.example.series_backend.dto;

import java.util.UUID;

public record EnqueueResult(UUID seriesId, boolean createdSeries, int createdEpisodes, int enqueuedJobs) {}
