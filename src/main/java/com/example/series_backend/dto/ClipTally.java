package com.example.series_backend.dto;

import java.util.List;
import java.util.UUID;

public record ClipTally(UUID episodeId, UUID seriesId, UUID winnerVariantId, String videoUrl, List<VariantTally> variants) {

    public record VariantTally(UUID variantId, int variantNumber, int voteCount) {}
}
