package com.example.series_backend.service;

import com.example.series_backend.dto.EpisodeBrief;
import com.example.series_backend.dto.ScriptData;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptDataCodecTest {

    private final ScriptDataCodec codec = new ScriptDataCodec(new ObjectMapper().findAndRegisterModules());

    private static final String PAYLOAD = """
            {
              "arc": {"beat_1": "Arrival", "beat_2": "Betrayal", "beat_3": "Escape"},
              "series_bible": {"global_style_bible": "Neon noir, rain"},
              "shots": [
                {"prompt": {"camera": "dolly in", "scene": "harbor at night", "motion": "slow"},
                 "audio": {"type": "ambient", "description": "waves"}},
                {"prompt": {"camera": "crane", "scene": "rooftop chase", "motion": "fast"},
                 "audio_type": "narration", "narration": "  She never looked back.  "}
              ],
              "poster_spec": {"mood": "tense"},
              "unexpected": 42
            }
            """;

    @Test
    void malformedPayloadFallsBackToDefaults() {
        ScriptData data = codec.read("{not json", "Title", "A logline", "thriller");

        assertEquals("Title", data.title());
        assertEquals("thriller", data.genre());
        assertEquals(ScriptDataCodec.DEFAULT_BEAT_1, data.arc().beat1());
        assertEquals(ScriptDataCodec.DEFAULT_STYLE_BIBLE, data.seriesBible().globalStyleBible());
        assertEquals(ScriptDataCodec.DEFAULT_POSTER_STYLE, data.posterSpec().style());
        assertEquals("Title", data.posterSpec().keyVisual());
        assertTrue(data.shots().isEmpty());
    }

    @Test
    void briefMapsBeatsAcrossTheSeason() {
        ScriptData data = codec.read(PAYLOAD, "Harbor", "Smugglers", "noir");

        assertEquals("Arrival", codec.briefFor(data, "Harbor", 1, "E1").beat());
        assertEquals("Betrayal", codec.briefFor(data, "Harbor", 2, "E2").beat());
        assertEquals("Betrayal", codec.briefFor(data, "Harbor", 3, "E3").beat());
        assertEquals("Escape", codec.briefFor(data, "Harbor", 5, "E5").beat());
    }

    @Test
    void briefUsesOwnShotOrFallsBackToTheFirst() {
        ScriptData data = codec.read(PAYLOAD, "Harbor", "Smugglers", "noir");

        EpisodeBrief second = codec.briefFor(data, "Harbor", 2, "E2");
        EpisodeBrief fourth = codec.briefFor(data, "Harbor", 4, "E4");

        assertEquals("rooftop chase", second.scene());
        assertEquals("harbor at night", fourth.scene());
        assertEquals("Neon noir, rain", fourth.styleBible());
        assertEquals("tense", fourth.mood());
    }

    @Test
    void narrationSkipsNonVoiceAudio() {
        ScriptData data = codec.read(PAYLOAD, "Harbor", "Smugglers", "noir");

        EpisodeBrief first = codec.briefFor(data, "Harbor", 1, "E1");

        assertEquals("She never looked back.", first.narrationText());
        assertTrue(first.hasNarration());
    }

    @Test
    void briefSurvivesStorage() {
        ScriptData data = codec.read(PAYLOAD, "Harbor", "Smugglers", "noir");
        EpisodeBrief brief = codec.briefFor(data, "Harbor", 2, "E2");

        assertEquals(brief, codec.readBrief(codec.writeBrief(brief)));
        assertNull(codec.readBrief("[broken"));
        assertNull(codec.readBrief(null));
    }
}
