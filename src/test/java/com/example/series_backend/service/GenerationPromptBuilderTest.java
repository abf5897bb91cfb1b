package com.example.series_backend.service;

import com.example.series_backend.dto.EpisodeBrief;
import com.example.series_backend.engine.Interfaces.PromptRefiner;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GenerationPromptBuilderTest {

    private static final EpisodeBrief BRIEF = new EpisodeBrief(2, "Salt Lines - Episode 2", "Salt Lines",
            "A keeper hears the sea answer.", "mystery", "The descent", "Cold blues, fog.",
            "close", "radio dial", "static", null, "noir", "beam over water", "uneasy");

    @Test
    void structuredPromptCarriesBeatAndShot() {
        String prompt = GenerationPromptBuilder.rawPrompt(BRIEF, 2);

        assertThat(prompt).startsWith("Episode 2 continuation for the series \"Salt Lines\".");
        assertThat(prompt).contains("Story beat: The descent", "Camera: close shot", "Scene: radio dial", "Mood: uneasy");
        assertThat(prompt).endsWith("Style: Cinematic noir, professional color grading, atmospheric lighting.");
    }

    @Test
    void sparseBriefFallsBackToGenreAndLogline() {
        EpisodeBrief sparse = new EpisodeBrief(1, "T", "T", "Smugglers at dawn.", "thriller",
                null, null, null, null, null, null, null, null, null);

        assertEquals("Episode 1 of a cinematic thriller film scene. Smugglers at dawn.",
                GenerationPromptBuilder.rawPrompt(sparse, 1));
        assertEquals("Episode 4 of a cinematic film scene.", GenerationPromptBuilder.rawPrompt(null, 4));
    }

    @Test
    void variantSuffixesWrapAround() {
        assertThat(GenerationPromptBuilder.variantPrompt("base", 1)).endsWith(GenerationPromptBuilder.VARIANT_SUFFIXES.get(0));
        assertThat(GenerationPromptBuilder.variantPrompt("base", 4)).endsWith(GenerationPromptBuilder.VARIANT_SUFFIXES.get(3));
        assertEquals(GenerationPromptBuilder.variantPrompt("base", 1), GenerationPromptBuilder.variantPrompt("base", 5));
    }

    @Test
    void refinerFailureKeepsTheRawPrompt() {
        PromptRefiner broken = raw -> {
            throw new IllegalStateException("model offline");
        };
        PromptRefiner blank = raw -> "  ";
        PromptRefiner good = raw -> "  refined  ";

        assertEquals(GenerationPromptBuilder.rawPrompt(BRIEF, 2), new GenerationPromptBuilder(broken).basePrompt(BRIEF, 2));
        assertEquals(GenerationPromptBuilder.rawPrompt(BRIEF, 2), new GenerationPromptBuilder(blank).basePrompt(BRIEF, 2));
        assertEquals("refined", new GenerationPromptBuilder(good).basePrompt(BRIEF, 2));
    }
}
