package com.example.series_backend.dto;

import com.example.series_backend.util.VariantStatus;

/**
 * Fields written when a variant row is created or overwritten by a production attempt.
 */
public record VariantWrite(
        VariantStatus status,
        String videoUrl,
        String prompt,
        String audioText,
        String modelUsed,
        Long seed,
        Double durationSeconds,
        Long generationTimeMs,
        String errorMessage,
        boolean selected
) {}
