package com.example.series_backend.service.handler;

import com.example.series_backend.config.ProductionProperties;
import com.example.series_backend.dto.EpisodeContext;
import com.example.series_backend.dto.VariantWrite;
import com.example.series_backend.engine.Interfaces.VideoGenerator;
import com.example.series_backend.exception.GenerationException;
import com.example.series_backend.service.EpisodeNarrator;
import com.example.series_backend.service.EpisodeService;
import com.example.series_backend.service.GenerationPromptBuilder;
import com.example.series_backend.service.Interfaces.ObjectStore;
import com.example.series_backend.util.VariantStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Shared clip generation for the job handlers: prompt, render, upload, record the variant.
 */
public abstract class AbstractVariantJobHandler implements ProductionJobHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractVariantJobHandler.class);

    protected final VideoGenerator generator;
    protected final ObjectStore store;
    protected final EpisodeService episodes;
    protected final GenerationPromptBuilder prompts;
    protected final EpisodeNarrator narrator;
    protected final ProductionProperties properties;
    protected final Clock clock;

    protected AbstractVariantJobHandler(VideoGenerator generator, ObjectStore store, EpisodeService episodes,
                                        GenerationPromptBuilder prompts, EpisodeNarrator narrator,
                                        ProductionProperties properties, Clock clock) {
        this.generator = generator;
        this.store = store;
        this.episodes = episodes;
        this.prompts = prompts;
        this.narrator = narrator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Renders and stores one variant. On failure a FAILED variant row is recorded and the error
     * is rethrown so the job attempt fails.
     *
     * @return the stored video URL.
     */
    protected String generateVariant(EpisodeContext ctx, String prompt, int variantNumber, boolean selected) {
        if (generator == null || store == null) {
            throw new GenerationException("Video generation or storage is not configured");
        }
        long started = System.currentTimeMillis();
        long seed = clock.millis() + variantNumber;
        String narration = ctx.brief() != null && ctx.brief().hasNarration() ? ctx.brief().narrationText() : null;
        try {
            VideoGenerator.Result result = generator.generate(new VideoGenerator.Request(
                    prompt, properties.getVideoWidth(), properties.getVideoHeight(), seed, narration));
            if (result == null || result.mediaBytes() == null || result.mediaBytes().length == 0) {
                throw new GenerationException("Generator returned no video for variant " + variantNumber);
            }
            String key = variantKey(ctx.episodeId(), variantNumber);
            ObjectStore.StoredObject stored = store.put(key, result.mediaBytes(), "video/mp4", Map.of(
                    "episodeId", ctx.episodeId().toString(),
                    "variant", String.valueOf(variantNumber),
                    "seed", String.valueOf(result.seed() != null ? result.seed() : seed)));
            long elapsed = System.currentTimeMillis() - started;
            episodes.upsertVariant(ctx.episodeId(), variantNumber, new VariantWrite(
                    VariantStatus.COMPLETED, stored.url(), prompt, narration, result.model(),
                    result.seed() != null ? result.seed() : seed, result.durationSeconds(), elapsed, null, selected));
            LOGGER.info("VARIANT OK episodeId={} variant={} bytes={} took={}ms",
                    ctx.episodeId(), variantNumber, result.mediaBytes().length, elapsed);
            return stored.url();
        } catch (RuntimeException e) {
            long elapsed = System.currentTimeMillis() - started;
            String error = truncate(String.valueOf(e.getMessage()), properties.getVariantErrorMaxLength());
            episodes.upsertVariant(ctx.episodeId(), variantNumber, new VariantWrite(
                    VariantStatus.FAILED, null, prompt, narration, null, seed, null, elapsed, error, false));
            LOGGER.warn("VARIANT FAIL episodeId={} variant={} err={}", ctx.episodeId(), variantNumber, e.toString());
            throw e;
        }
    }

    public static String variantKey(UUID episodeId, int variantNumber) {
        return "episodes/" + episodeId + "/variant-" + variantNumber + ".mp4";
    }

    private static String truncate(String s, int max) {
        int limit = Math.max(16, max);
        return s.length() <= limit ? s : s.substring(0, limit);
    }
}
