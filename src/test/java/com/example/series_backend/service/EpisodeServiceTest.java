package com.example.series_backend.service;

import com.example.series_backend.dto.EpisodeBrief;
import com.example.series_backend.dto.EpisodeContext;
import com.example.series_backend.dto.VariantWrite;
import com.example.series_backend.model.ClipVariant;
import com.example.series_backend.model.Episode;
import com.example.series_backend.model.Series;
import com.example.series_backend.repository.ClipVariantRepository;
import com.example.series_backend.repository.EpisodeRepository;
import com.example.series_backend.repository.SeriesRepository;
import com.example.series_backend.util.EpisodeStatus;
import com.example.series_backend.util.VariantStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import({EpisodeService.class, ScriptDataCodec.class, ServiceTestConfig.class})
class EpisodeServiceTest {

    @Autowired private EpisodeService episodes;
    @Autowired private ScriptDataCodec codec;
    @Autowired private SeriesRepository seriesRepo;
    @Autowired private EpisodeRepository episodeRepo;
    @Autowired private ClipVariantRepository variantRepo;

    private UUID seriesId;
    private UUID episodeId;

    @BeforeEach
    void setUp() {
        Series series = seriesRepo.saveAndFlush(new Series(UUID.randomUUID(), "Salt Lines"));
        seriesId = series.getId();
        Episode pilot = new Episode(series, 1, "Salt Lines - Pilot");
        pilot.setBrief(codec.writeBrief(new EpisodeBrief(1, "Salt Lines - Pilot", "Salt Lines", "logline", "mystery",
                "The signal", null, null, "lighthouse", null, "Every night the light turns.", null, null, null)));
        episodeId = episodeRepo.saveAndFlush(pilot).getId();
    }

    @Test
    void contextCarriesTheStoredBrief() {
        EpisodeContext ctx = episodes.loadContext(episodeId);

        assertEquals(seriesId, ctx.seriesId());
        assertEquals(1, ctx.episodeNumber());
        assertEquals(EpisodeStatus.PENDING, ctx.status());
        assertEquals("The signal", ctx.brief().beat());
        assertTrue(ctx.brief().hasNarration());
        assertFalse(ctx.alreadySelected());
    }

    @Test
    void missingEpisodeHasNoContext() {
        assertTrue(episodes.findContext(UUID.randomUUID()).isEmpty());
        assertThrows(IllegalStateException.class, () -> episodes.loadContext(UUID.randomUUID()));
    }

    @Test
    void rewritingAVariantKeepsItsVotes() {
        UUID id = episodes.upsertVariant(episodeId, 2, write(VariantStatus.FAILED, null, "timeout"));
        ClipVariant stored = variantRepo.findById(id).orElseThrow();
        stored.setVoteCount(3);
        variantRepo.saveAndFlush(stored);

        UUID again = episodes.upsertVariant(episodeId, 2, write(VariantStatus.COMPLETED, "https://cdn.example.com/v2.mp4", null));

        assertEquals(id, again);
        ClipVariant after = variantRepo.findById(id).orElseThrow();
        assertEquals(VariantStatus.COMPLETED, after.getStatus());
        assertEquals("https://cdn.example.com/v2.mp4", after.getVideoUrl());
        assertNull(after.getErrorMessage());
        assertEquals(3, after.getVoteCount());
    }

    @Test
    void selectionPointsTheEpisodeAtTheClip() {
        episodes.openClipVoting(episodeId, ServiceTestConfig.NOW);
        episodes.markSelected(episodeId, "https://cdn.example.com/v1.mp4");
        episodes.attachNarration(episodeId, "https://cdn.example.com/tts.mp3");

        Episode e = episodeRepo.findById(episodeId).orElseThrow();
        assertEquals(EpisodeStatus.CLIP_SELECTED, e.getStatus());
        assertEquals("https://cdn.example.com/v1.mp4", e.getVideoUrl());
        assertEquals("https://cdn.example.com/tts.mp3", e.getTtsAudioUrl());
        assertNull(e.getClipVotingEndsAt());
        assertTrue(episodes.loadContext(episodeId).alreadySelected());
    }

    private static VariantWrite write(VariantStatus status, String url, String error) {
        return new VariantWrite(status, url, "prompt", null, "ltx", 42L, 5.0, 1200L, error, false);
    }
}
