package com.example.series_backend.service.handler;

import com.example.series_backend.config.ProductionProperties;
import com.example.series_backend.config.VotingProperties;
import com.example.series_backend.dto.ClaimedJob;
import com.example.series_backend.dto.EpisodeContext;
import com.example.series_backend.dto.VariantWrite;
import com.example.series_backend.engine.Interfaces.VideoGenerator;
import com.example.series_backend.exception.GenerationException;
import com.example.series_backend.service.EpisodeNarrator;
import com.example.series_backend.service.EpisodeService;
import com.example.series_backend.service.GenerationPromptBuilder;
import com.example.series_backend.service.Interfaces.ObjectStore;
import com.example.series_backend.service.VotingRuntimeConfigService;
import com.example.series_backend.util.EpisodeStatus;
import com.example.series_backend.util.JobType;
import com.example.series_backend.util.VariantStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PilotVariantsJobHandlerTest {

    private static final Instant NOW = Instant.parse("2025-03-05T12:00:00Z");

    @Mock private VideoGenerator generator;
    @Mock private ObjectStore store;
    @Mock private EpisodeService episodes;
    @Mock private GenerationPromptBuilder prompts;
    @Mock private EpisodeNarrator narrator;

    private PilotVariantsJobHandler handler;
    private final UUID episodeId = UUID.randomUUID();
    private final ClaimedJob job = new ClaimedJob(UUID.randomUUID(), UUID.randomUUID(), episodeId, 1, JobType.PILOT_VARIANTS, 0, 3);

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        VotingRuntimeConfigService votingConfig = new VotingRuntimeConfigService(new VotingProperties(), clock);
        handler = new PilotVariantsJobHandler(generator, store, episodes, prompts, narrator,
                new ProductionProperties(), votingConfig, clock);
    }

    @Test
    void rendersFourVariantsThenOpensClipVoting() {
        EpisodeContext ctx = context(EpisodeStatus.PENDING, null);
        when(episodes.loadContext(episodeId)).thenReturn(ctx);
        when(prompts.basePrompt(ctx.brief(), 1)).thenReturn("harbor at night");
        when(generator.generate(any())).thenReturn(new VideoGenerator.Result(new byte[]{1, 2}, 7L, "ltx", 5.0));
        when(store.put(anyString(), any(), eq("video/mp4"), anyMap()))
                .thenAnswer(inv -> new ObjectStore.StoredObject(inv.getArgument(0), "https://cdn.example.com/" + inv.getArgument(0)));

        handler.execute(job);

        verify(episodes).markGenerating(episodeId);
        ArgumentCaptor<VariantWrite> writes = ArgumentCaptor.forClass(VariantWrite.class);
        verify(episodes, times(4)).upsertVariant(eq(episodeId), anyInt(), writes.capture());
        assertThat(writes.getAllValues()).allMatch(w -> w.status() == VariantStatus.COMPLETED && !w.selected());
        verify(store).put(eq(AbstractVariantJobHandler.variantKey(episodeId, 4)), any(), eq("video/mp4"), anyMap());
        verify(episodes).openClipVoting(episodeId, NOW.plus(Duration.ofMinutes(2880)));
        verify(narrator).narrate(ctx);
    }

    @Test
    void failedVariantIsRecordedAndFailsTheAttempt() {
        EpisodeContext ctx = context(EpisodeStatus.PENDING, null);
        when(episodes.loadContext(episodeId)).thenReturn(ctx);
        when(prompts.basePrompt(ctx.brief(), 1)).thenReturn("harbor at night");
        when(generator.generate(any()))
                .thenReturn(new VideoGenerator.Result(new byte[]{1}, 1L, "ltx", 5.0))
                .thenThrow(new GenerationException("quota exceeded"));
        when(store.put(anyString(), any(), eq("video/mp4"), anyMap()))
                .thenAnswer(inv -> new ObjectStore.StoredObject(inv.getArgument(0), "https://cdn.example.com/" + inv.getArgument(0)));

        assertThrows(GenerationException.class, () -> handler.execute(job));

        ArgumentCaptor<VariantWrite> failed = ArgumentCaptor.forClass(VariantWrite.class);
        verify(episodes).upsertVariant(eq(episodeId), eq(2), failed.capture());
        assertEquals(VariantStatus.FAILED, failed.getValue().status());
        assertEquals("quota exceeded", failed.getValue().errorMessage());
        verify(episodes, never()).openClipVoting(any(), any());
        verifyNoInteractions(narrator);
    }

    @Test
    void alreadySelectedPilotIsLeftAlone() {
        when(episodes.loadContext(episodeId)).thenReturn(context(EpisodeStatus.CLIP_SELECTED, "https://cdn.example.com/v.mp4"));

        handler.execute(job);

        verifyNoInteractions(generator, store, narrator);
        verify(episodes, never()).markGenerating(any());
    }

    private EpisodeContext context(EpisodeStatus status, String videoUrl) {
        return new EpisodeContext(episodeId, job.seriesId(), 1, status, videoUrl, null, null);
    }
}
