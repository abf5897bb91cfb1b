package com.example.series_backend.service;

import com.example.series_backend.config.ProductionProperties;
import com.example.series_backend.dto.EpisodeContext;
import com.example.series_backend.engine.Interfaces.MediaFetcher;
import com.example.series_backend.engine.Interfaces.NarrationSynthesizer;
import com.example.series_backend.service.Interfaces.ObjectStore;
import com.example.series_backend.util.AudioExtensions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Best-effort narration: synthesizes the episode's narration text, stores it under a fixed key
 * and attaches the URL. Failures are logged and never fail the job.
 */
@Component
public class EpisodeNarrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(EpisodeNarrator.class);

    private final NarrationSynthesizer synthesizer;
    private final ObjectStore store;
    private final MediaFetcher fetcher;
    private final EpisodeService episodes;
    private final ProductionProperties properties;

    public EpisodeNarrator(@Nullable NarrationSynthesizer synthesizer, @Nullable ObjectStore store,
                           MediaFetcher fetcher, EpisodeService episodes, ProductionProperties properties) {
        this.synthesizer = synthesizer;
        this.store = store;
        this.fetcher = fetcher;
        this.episodes = episodes;
        this.properties = properties;
    }

    /**
     * @return true if a narration track was attached.
     */
    public boolean narrate(EpisodeContext ctx) {
        if (synthesizer == null || store == null) {
            return false;
        }
        if (ctx.ttsAudioUrl() != null || ctx.brief() == null || !ctx.brief().hasNarration()) {
            return false;
        }
        try {
            NarrationSynthesizer.Result tts = synthesizer.synthesizeAndWait(
                    ctx.brief().narrationText(), Duration.ofSeconds(Math.max(1, properties.getNarrationTimeoutSeconds())));
            MediaFetcher.Download audio = fetcher.fetch(tts.audioUrl());
            String contentType = audio.contentType() != null ? audio.contentType() : tts.contentType();
            String key = narrationKey(ctx.episodeId().toString(), AudioExtensions.forContentType(contentType));
            ObjectStore.StoredObject stored = store.put(key, audio.bytes(),
                    contentType != null ? contentType : "audio/mpeg",
                    Map.of("episodeId", ctx.episodeId().toString(), "kind", "tts"));
            episodes.attachNarration(ctx.episodeId(), stored.url());
            LOGGER.info("NARRATION OK episodeId={} key={} bytes={}", ctx.episodeId(), key, audio.bytes().length);
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("NARRATION FAIL episodeId={} err={}", ctx.episodeId(), e.toString());
            return false;
        }
    }

    static String narrationKey(String episodeId, String extension) {
        return "episodes/" + episodeId + "/tts." + extension;
    }
}
