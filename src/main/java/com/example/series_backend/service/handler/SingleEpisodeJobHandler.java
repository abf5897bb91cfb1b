package com.example.series_backend.service.handler;

import com.example.series_backend.config.ProductionProperties;
import com.example.series_backend.dto.ClaimedJob;
import com.example.series_backend.dto.EpisodeContext;
import com.example.series_backend.engine.Interfaces.VideoGenerator;
import com.example.series_backend.service.EpisodeNarrator;
import com.example.series_backend.service.EpisodeService;
import com.example.series_backend.service.GenerationPromptBuilder;
import com.example.series_backend.service.Interfaces.ObjectStore;
import com.example.series_backend.util.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Renders a follow-up episode as a single clip that is selected immediately.
 */
@Component
public class SingleEpisodeJobHandler extends AbstractVariantJobHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(SingleEpisodeJobHandler.class);

    public SingleEpisodeJobHandler(@Nullable VideoGenerator generator, @Nullable ObjectStore store,
                                   EpisodeService episodes, GenerationPromptBuilder prompts,
                                   EpisodeNarrator narrator, ProductionProperties properties, Clock clock) {
        super(generator, store, episodes, prompts, narrator, properties, clock);
    }

    @Override
    public JobType handlesType() {
        return JobType.SINGLE_EPISODE;
    }

    @Override
    public void execute(ClaimedJob job) {
        EpisodeContext ctx = episodes.loadContext(job.episodeId());
        if (ctx.alreadySelected()) {
            LOGGER.info("EPISODE SKIP episodeId={} reason=already_selected", ctx.episodeId());
            return;
        }
        episodes.markGenerating(ctx.episodeId());

        String prompt = prompts.basePrompt(ctx.brief(), ctx.episodeNumber());
        String url = generateVariant(ctx, prompt, 1, true);
        episodes.markSelected(ctx.episodeId(), url);
        LOGGER.info("EPISODE READY episodeId={} number={}", ctx.episodeId(), ctx.episodeNumber());

        narrator.narrate(ctx);
    }
}
