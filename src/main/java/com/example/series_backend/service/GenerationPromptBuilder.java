package com.example.series_backend.service;

import com.example.series_backend.dto.EpisodeBrief;
import com.example.series_backend.engine.Interfaces.PromptRefiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GenerationPromptBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationPromptBuilder.class);

    static final List<String> VARIANT_SUFFIXES = List.of(
            "With dramatic atmospheric fog and volumetric lighting.",
            "Shot with slow dolly movement, shallow depth of field.",
            "High contrast cinematography, rich shadows, silhouettes.",
            "Dynamic camera movement, energetic pacing, vivid colors.");

    private final PromptRefiner refiner;

    public GenerationPromptBuilder(@Nullable PromptRefiner refiner) {
        this.refiner = refiner;
    }

    /**
     * Prompt for one episode, refined when a refiner is available.
     */
    public String basePrompt(@Nullable EpisodeBrief brief, int episodeNumber) {
        String raw = rawPrompt(brief, episodeNumber);
        if (refiner == null) {
            return raw;
        }
        try {
            String refined = refiner.refine(raw);
            return refined == null || refined.isBlank() ? raw : refined.trim();
        } catch (RuntimeException e) {
            LOGGER.warn("PROMPT REFINE FAIL episode={} err={}", episodeNumber, e.toString());
            return raw;
        }
    }

    /**
     * Appends the style suffix for a 1-based variant number; numbers past the table wrap around.
     */
    public static String variantPrompt(String base, int variantNumber) {
        String suffix = VARIANT_SUFFIXES.get(Math.floorMod(variantNumber - 1, VARIANT_SUFFIXES.size()));
        return base + "\n\n" + suffix;
    }

    static String rawPrompt(@Nullable EpisodeBrief brief, int episodeNumber) {
        if (brief == null) {
            return "Episode " + episodeNumber + " of a cinematic film scene.";
        }
        if (brief.beat() == null && brief.scene() == null) {
            return "Episode " + episodeNumber + " of a cinematic " + orElse(brief.genre(), "drama") + " film scene. "
                    + orElse(brief.logline(), "");
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Episode ").append(episodeNumber).append(" continuation for the series \"")
                .append(orElse(brief.seriesTitle(), brief.title())).append("\".\n");
        sb.append(orElse(brief.styleBible(), "")).append("\n\n");
        sb.append("Story beat: ").append(orElse(brief.beat(), "")).append("\n\n");
        sb.append("Camera: ").append(orElse(brief.camera(), "medium")).append(" shot\n");
        sb.append("Scene: ").append(orElse(brief.scene(), orElse(brief.keyVisual(), ""))).append("\n");
        sb.append("Motion: ").append(orElse(brief.motion(), "subtle")).append("\n");
        sb.append("Mood: ").append(orElse(brief.mood(), "cinematic")).append("\n\n");
        sb.append("Style: Cinematic ").append(orElse(brief.posterStyle(), "cinematic"))
                .append(", professional color grading, atmospheric lighting.");
        return sb.toString();
    }

    private static String orElse(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
