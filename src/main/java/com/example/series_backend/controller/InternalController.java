package com.example.series_backend.controller;

import com.example.series_backend.config.TickProperties;
import com.example.series_backend.dto.FinalizeResult;
import com.example.series_backend.dto.TickResult;
import com.example.series_backend.dto.VotingDashboard;
import com.example.series_backend.dto.VotingRuntimeConfig;
import com.example.series_backend.dto.web.VotingConfigPatchRequest;
import com.example.series_backend.exception.FinalizationException;
import com.example.series_backend.service.EpisodeFinalizer;
import com.example.series_backend.service.ProductionJobService;
import com.example.series_backend.service.VotingRuntimeConfigService;
import com.example.series_backend.service.VotingScheduler;
import com.example.series_backend.service.VotingTickService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.UUID;

/**
 * Operator and cron endpoints. Every route requires the shared cron secret.
 */
@RestController
@RequestMapping("/internal")
public class InternalController {
    private static final Logger LOGGER = LoggerFactory.getLogger(InternalController.class);
    static final String SECRET_HEADER = "X-Cron-Secret";

    private final VotingTickService tickService;
    private final VotingScheduler scheduler;
    private final VotingRuntimeConfigService votingConfig;
    private final ProductionJobService jobService;
    private final EpisodeFinalizer finalizer;
    private final TickProperties tickProperties;

    public InternalController(VotingTickService tickService, VotingScheduler scheduler,
                              VotingRuntimeConfigService votingConfig, ProductionJobService jobService,
                              EpisodeFinalizer finalizer, TickProperties tickProperties) {
        this.tickService = tickService;
        this.scheduler = scheduler;
        this.votingConfig = votingConfig;
        this.jobService = jobService;
        this.finalizer = finalizer;
        this.tickProperties = tickProperties;
    }

    @PostMapping("/cron/voting-tick")
    public TickResult tick(@RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        authorize(secret);
        return tickService.tick();
    }

    @GetMapping("/voting/dashboard")
    public VotingDashboard dashboard(@RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        authorize(secret);
        return scheduler.getVotingDashboard();
    }

    @GetMapping("/voting/config")
    public VotingRuntimeConfig getConfig(@RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        authorize(secret);
        return votingConfig.get();
    }

    @PatchMapping("/voting/config")
    public VotingRuntimeConfig patchConfig(@RequestHeader(value = SECRET_HEADER, required = false) String secret,
                                           @Valid @RequestBody VotingConfigPatchRequest req) {
        authorize(secret);
        return votingConfig.update(req);
    }

    @PostMapping("/production/sweep-stuck")
    public Map<String, Integer> sweepStuck(@RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        authorize(secret);
        return Map.of("swept", jobService.sweepStuckJobs());
    }

    @PostMapping("/episodes/{id}/finalize")
    public FinalizeResult finalizeEpisode(@RequestHeader(value = SECRET_HEADER, required = false) String secret,
                                          @PathVariable UUID id) {
        authorize(secret);
        try {
            return finalizer.finalizeEpisode(id);
        } catch (FinalizationException e) {
            LOGGER.warn("FINALIZE FAIL episodeId={} err={}", id, e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "FINALIZE_FAILED", e);
        }
    }

    private void authorize(String provided) {
        String expected = tickProperties.getCronSecret();
        if (expected == null || expected.isBlank()) {
            if (tickProperties.isAllowUnauthenticated()) {
                return;
            }
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "CRON_SECRET_NOT_CONFIGURED");
        }
        if (provided == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CRON_SECRET");
        }
    }
}
