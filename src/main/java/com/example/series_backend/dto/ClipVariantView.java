package com.example.series_backend.dto;

import com.example.series_backend.model.ClipVariant;
import com.example.series_backend.util.VariantStatus;

import java.util.UUID;

public record ClipVariantView(
        UUID id,
        int variantNumber,
        String videoUrl,
        int voteCount,
        boolean selected,
        VariantStatus status
) {
    public static ClipVariantView from(ClipVariant v) {
        return new ClipVariantView(v.getId(), v.getVariantNumber(), v.getVideoUrl(), v.getVoteCount(), v.isSelected(), v.getStatus());
    }
}
