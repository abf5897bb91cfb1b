package com.example.series_backend.service.handler;

import com.example.series_backend.config.ProductionProperties;
import com.example.series_backend.dto.ClaimedJob;
import com.example.series_backend.dto.EpisodeContext;
import com.example.series_backend.dto.VariantWrite;
import com.example.series_backend.engine.Interfaces.VideoGenerator;
import com.example.series_backend.exception.GenerationException;
import com.example.series_backend.service.EpisodeNarrator;
import com.example.series_backend.service.EpisodeService;
import com.example.series_backend.service.GenerationPromptBuilder;
import com.example.series_backend.service.Interfaces.ObjectStore;
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
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SingleEpisodeJobHandlerTest {

    @Mock private VideoGenerator generator;
    @Mock private ObjectStore store;
    @Mock private EpisodeService episodes;
    @Mock private GenerationPromptBuilder prompts;
    @Mock private EpisodeNarrator narrator;

    private SingleEpisodeJobHandler handler;
    private final UUID episodeId = UUID.randomUUID();
    private final ClaimedJob job = new ClaimedJob(UUID.randomUUID(), UUID.randomUUID(), episodeId, 3, JobType.SINGLE_EPISODE, 1, 3);

    @BeforeEach
    void setUp() {
        handler = new SingleEpisodeJobHandler(generator, store, episodes, prompts, narrator,
                new ProductionProperties(), Clock.fixed(Instant.parse("2025-03-05T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void rendersOneSelectedClip() {
        EpisodeContext ctx = new EpisodeContext(episodeId, job.seriesId(), 3, EpisodeStatus.PENDING, null, null, null);
        String key = AbstractVariantJobHandler.variantKey(episodeId, 1);
        when(episodes.loadContext(episodeId)).thenReturn(ctx);
        when(prompts.basePrompt(null, 3)).thenReturn("Episode 3 of a cinematic film scene.");
        when(generator.generate(any())).thenReturn(new VideoGenerator.Result(new byte[]{1, 2, 3}, null, "ltx", 5.0));
        when(store.put(eq(key), any(), eq("video/mp4"), anyMap()))
                .thenReturn(new ObjectStore.StoredObject(key, "https://cdn.example.com/" + key));

        handler.execute(job);

        ArgumentCaptor<VariantWrite> write = ArgumentCaptor.forClass(VariantWrite.class);
        verify(episodes).upsertVariant(eq(episodeId), eq(1), write.capture());
        assertTrue(write.getValue().selected());
        assertEquals(VariantStatus.COMPLETED, write.getValue().status());
        verify(episodes).markSelected(episodeId, "https://cdn.example.com/" + key);
        verify(narrator).narrate(ctx);
    }

    @Test
    void emptyRenderCountsAsFailure() {
        EpisodeContext ctx = new EpisodeContext(episodeId, job.seriesId(), 3, EpisodeStatus.PENDING, null, null, null);
        when(episodes.loadContext(episodeId)).thenReturn(ctx);
        when(prompts.basePrompt(null, 3)).thenReturn("prompt");
        when(generator.generate(any())).thenReturn(new VideoGenerator.Result(new byte[0], null, "ltx", null));

        assertThrows(GenerationException.class, () -> handler.execute(job));

        verify(episodes).upsertVariant(eq(episodeId), eq(1), any(VariantWrite.class));
        verify(episodes, never()).markSelected(any(), any());
    }
}
