package com.example.series_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured production data attached to a script. Parsed leniently: missing blocks become
 * {@code null} here and are filled with defaults by {@code ScriptDataCodec}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScriptData(
        String title,
        String logline,
        String genre,
        Arc arc,
        @JsonProperty("series_bible") SeriesBible seriesBible,
        List<Shot> shots,
        @JsonProperty("poster_spec") PosterSpec posterSpec
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Arc(
            @JsonProperty("beat_1") String beat1,
            @JsonProperty("beat_2") String beat2,
            @JsonProperty("beat_3") String beat3
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SeriesBible(
            @JsonProperty("global_style_bible") String globalStyleBible,
            @JsonProperty("location_anchors") List<Anchor> locationAnchors,
            @JsonProperty("character_anchors") List<Anchor> characterAnchors,
            @JsonProperty("do_not_change") List<String> doNotChange
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Anchor(String id, String name, String visual) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Shot(
            ShotPrompt prompt,
            @JsonProperty("gen_clip_seconds") Double genClipSeconds,
            @JsonProperty("duration_seconds") Double durationSeconds,
            @JsonProperty("edit_extend_strategy") String editExtendStrategy,
            ShotAudio audio,
            @JsonProperty("audio_type") String audioType,
            String narration,
            Dialogue dialogue
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ShotPrompt(String camera, String scene, String motion) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ShotAudio(
            String type,
            String description,
            @JsonProperty("voice_id") String voiceId,
            Dialogue dialogue
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Dialogue(String speaker, String line) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PosterSpec(
            String style,
            @JsonProperty("key_visual") String keyVisual,
            String mood
    ) {}
}
