package com.example.series_backend.service;

import com.example.series_backend.dto.EpisodeBrief;
import com.example.series_backend.dto.ScriptData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The only place structured production data crosses the JSON boundary. Reads are lenient:
 * malformed payloads degrade to defaults instead of failing production.
 */
@Component
public class ScriptDataCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptDataCodec.class);

    static final String DEFAULT_BEAT_1 = "Opening movement.";
    static final String DEFAULT_BEAT_2 = "Conflict escalates.";
    static final String DEFAULT_BEAT_3 = "Consequence and hook.";
    static final String DEFAULT_STYLE_BIBLE = "Cinematic continuity and visual consistency.";
    static final String DEFAULT_POSTER_STYLE = "cinematic";

    private static final Set<String> TTS_AUDIO_TYPES = Set.of("tts", "narration", "voiceover", "voice_over", "voice");

    private final ObjectMapper mapper;

    public ScriptDataCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses a stored script payload and fills every missing block with defaults.
     */
    public ScriptData read(String json, String title, String logline, String genre) {
        ScriptData raw = null;
        if (json != null && !json.isBlank()) {
            try {
                raw = mapper.readValue(json, ScriptData.class);
            } catch (JsonProcessingException e) {
                LOGGER.warn("Script data unreadable, using defaults: {}", e.getOriginalMessage());
            }
        }
        return withDefaults(raw, title, logline, genre);
    }

    static ScriptData withDefaults(ScriptData raw, String title, String logline, String genre) {
        ScriptData src = raw != null ? raw : new ScriptData(null, null, null, null, null, null, null);
        ScriptData.Arc arc = src.arc() != null ? src.arc() : new ScriptData.Arc(null, null, null);
        ScriptData.SeriesBible bible = src.seriesBible() != null ? src.seriesBible() : new ScriptData.SeriesBible(null, null, null, null);
        ScriptData.PosterSpec poster = src.posterSpec() != null ? src.posterSpec() : new ScriptData.PosterSpec(null, null, null);
        String resolvedTitle = firstText(src.title(), title);

        return new ScriptData(
                resolvedTitle,
                firstText(src.logline(), logline, ""),
                firstText(src.genre(), genre),
                new ScriptData.Arc(
                        firstText(arc.beat1(), DEFAULT_BEAT_1),
                        firstText(arc.beat2(), DEFAULT_BEAT_2),
                        firstText(arc.beat3(), DEFAULT_BEAT_3)),
                new ScriptData.SeriesBible(
                        firstText(bible.globalStyleBible(), DEFAULT_STYLE_BIBLE),
                        bible.locationAnchors(),
                        bible.characterAnchors(),
                        bible.doNotChange()),
                src.shots() != null ? src.shots() : List.of(),
                new ScriptData.PosterSpec(
                        firstText(poster.style(), DEFAULT_POSTER_STYLE),
                        firstText(poster.keyVisual(), resolvedTitle),
                        poster.mood()));
    }

    /**
     * Builds the snapshot for one episode. Episode 1 follows beat 1, episodes 2-3 beat 2 and
     * the rest beat 3; episode n takes shot n when the script has one, otherwise the first shot.
     */
    public EpisodeBrief briefFor(ScriptData data, String seriesTitle, int episodeNumber, String episodeTitle) {
        ScriptData.Arc arc = data.arc();
        String beat = episodeNumber <= 1 ? arc.beat1() : episodeNumber <= 3 ? arc.beat2() : arc.beat3();

        List<ScriptData.Shot> shots = data.shots();
        ScriptData.Shot shot = null;
        if (!shots.isEmpty()) {
            shot = episodeNumber - 1 < shots.size() ? shots.get(episodeNumber - 1) : shots.get(0);
        }
        ScriptData.ShotPrompt prompt = shot != null ? shot.prompt() : null;

        return new EpisodeBrief(
                episodeNumber,
                episodeTitle,
                seriesTitle,
                data.logline(),
                data.genre(),
                beat,
                data.seriesBible().globalStyleBible(),
                prompt != null ? prompt.camera() : null,
                prompt != null ? prompt.scene() : null,
                prompt != null ? prompt.motion() : null,
                narrationFor(shots, shot),
                data.posterSpec().style(),
                data.posterSpec().keyVisual(),
                data.posterSpec().mood());
    }

    /**
     * Narration comes from the episode's own shot when it carries one, otherwise from the first
     * shot in the script that does.
     */
    static String narrationFor(List<ScriptData.Shot> shots, ScriptData.Shot preferred) {
        String own = narrationOf(preferred);
        if (own != null) return own;
        for (ScriptData.Shot shot : shots) {
            String text = narrationOf(shot);
            if (text != null) return text;
        }
        return null;
    }

    private static String narrationOf(ScriptData.Shot shot) {
        if (shot == null) return null;
        ScriptData.ShotAudio audio = shot.audio();
        if (audio != null && hasText(audio.description()) && TTS_AUDIO_TYPES.contains(lower(audio.type()))) {
            return audio.description().trim();
        }
        if ("narration".equals(lower(shot.audioType())) && hasText(shot.narration())) {
            return shot.narration().trim();
        }
        return null;
    }

    public String writeBrief(EpisodeBrief brief) {
        return write(brief);
    }

    public EpisodeBrief readBrief(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(json, EpisodeBrief.class);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Episode brief unreadable: {}", e.getOriginalMessage());
            return null;
        }
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String firstText(String... candidates) {
        for (String c : candidates) {
            if (hasText(c)) return c;
        }
        return null;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
