package com.example.series_backend.service.handler;

import com.example.series_backend.config.ProductionProperties;
import com.example.series_backend.dto.ClaimedJob;
import com.example.series_backend.dto.EpisodeContext;
import com.example.series_backend.engine.Interfaces.VideoGenerator;
import com.example.series_backend.service.EpisodeNarrator;
import com.example.series_backend.service.EpisodeService;
import com.example.series_backend.service.GenerationPromptBuilder;
import com.example.series_backend.service.Interfaces.ObjectStore;
import com.example.series_backend.service.VotingRuntimeConfigService;
import com.example.series_backend.util.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Renders the pilot's competing variants and opens clip voting on them.
 */
@Component
public class PilotVariantsJobHandler extends AbstractVariantJobHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PilotVariantsJobHandler.class);

    private final VotingRuntimeConfigService votingConfig;

    public PilotVariantsJobHandler(@Nullable VideoGenerator generator, @Nullable ObjectStore store,
                                   EpisodeService episodes, GenerationPromptBuilder prompts,
                                   EpisodeNarrator narrator, ProductionProperties properties,
                                   VotingRuntimeConfigService votingConfig, Clock clock) {
        super(generator, store, episodes, prompts, narrator, properties, clock);
        this.votingConfig = votingConfig;
    }

    @Override
    public JobType handlesType() {
        return JobType.PILOT_VARIANTS;
    }

    @Override
    public void execute(ClaimedJob job) {
        EpisodeContext ctx = episodes.loadContext(job.episodeId());
        if (ctx.alreadySelected()) {
            LOGGER.info("PILOT SKIP episodeId={} reason=already_selected", ctx.episodeId());
            return;
        }
        episodes.markGenerating(ctx.episodeId());

        String base = prompts.basePrompt(ctx.brief(), ctx.episodeNumber());
        int count = Math.max(1, properties.getPilotVariantCount());
        for (int n = 1; n <= count; n++) {
            generateVariant(ctx, GenerationPromptBuilder.variantPrompt(base, n), n, false);
        }

        Instant endsAt = clock.instant().plus(Duration.ofMinutes(votingConfig.get().clipVotingDurationMinutes()));
        episodes.openClipVoting(ctx.episodeId(), endsAt);
        LOGGER.info("PILOT READY episodeId={} variants={} clipVotingEndsAt={}", ctx.episodeId(), count, endsAt);

        narrator.narrate(ctx);
    }
}
