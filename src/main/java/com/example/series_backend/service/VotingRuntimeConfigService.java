package com.example.series_backend.service;

import com.example.series_backend.config.VotingProperties;
import com.example.series_backend.dto.VotingRuntimeConfig;
import com.example.series_backend.dto.web.VotingConfigPatchRequest;
import com.example.series_backend.util.VotingCadence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the effective voting schedule. Seeded from {@link VotingProperties}, adjustable at runtime
 * by an operator; every value is clamped to its allowed range.
 */
@Service
public class VotingRuntimeConfigService {
    private static final Logger LOGGER = LoggerFactory.getLogger(VotingRuntimeConfigService.class);

    static final int MAX_SCRIPT_VOTING_MINUTES = 30 * 24 * 60;
    static final int MAX_CLIP_VOTING_MINUTES = 14 * 24 * 60;
    static final int MAX_IMMEDIATE_DELAY_SECONDS = 300;

    private final Clock clock;
    private final AtomicReference<VotingRuntimeConfig> current;

    public VotingRuntimeConfigService(VotingProperties properties, Clock clock) {
        this.clock = clock;
        VotingCadence cadence = properties.getCadence() != null ? properties.getCadence() : VotingCadence.WEEKLY;
        this.current = new AtomicReference<>(new VotingRuntimeConfig(
                cadence,
                clamp(properties.getScriptVotingDurationMinutes(), 1, MAX_SCRIPT_VOTING_MINUTES),
                clamp(properties.getClipVotingDurationMinutes(), 1, MAX_CLIP_VOTING_MINUTES),
                clamp(properties.getStartDayOfWeek(), 0, 6),
                clamp(properties.getStartHourUtc(), 0, 23),
                clamp(properties.getImmediateStartDelaySeconds(), 0, MAX_IMMEDIATE_DELAY_SECONDS),
                Math.max(1, properties.getMinScriptsForVoting()),
                null,
                null));
    }

    public VotingRuntimeConfig get() {
        return current.get();
    }

    /**
     * Applies a partial update. Unknown cadence values are rejected, numbers are clamped.
     */
    public VotingRuntimeConfig update(VotingConfigPatchRequest patch) {
        VotingCadence cadence = null;
        if (patch.cadence() != null) {
            cadence = VotingCadence.parse(patch.cadence());
            if (cadence == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_CADENCE");
            }
        }
        final VotingCadence newCadence = cadence;
        VotingRuntimeConfig updated = current.updateAndGet(old -> new VotingRuntimeConfig(
                newCadence != null ? newCadence : old.cadence(),
                patch.scriptVotingDurationMinutes() != null
                        ? clamp(patch.scriptVotingDurationMinutes(), 1, MAX_SCRIPT_VOTING_MINUTES)
                        : old.scriptVotingDurationMinutes(),
                patch.clipVotingDurationMinutes() != null
                        ? clamp(patch.clipVotingDurationMinutes(), 1, MAX_CLIP_VOTING_MINUTES)
                        : old.clipVotingDurationMinutes(),
                patch.startDayOfWeek() != null ? clamp(patch.startDayOfWeek(), 0, 6) : old.startDayOfWeek(),
                patch.startHourUtc() != null ? clamp(patch.startHourUtc(), 0, 23) : old.startHourUtc(),
                patch.immediateStartDelaySeconds() != null
                        ? clamp(patch.immediateStartDelaySeconds(), 0, MAX_IMMEDIATE_DELAY_SECONDS)
                        : old.immediateStartDelaySeconds(),
                patch.minScriptsForVoting() != null ? Math.max(1, patch.minScriptsForVoting()) : old.minScriptsForVoting(),
                clock.instant(),
                patch.updatedBy()));
        LOGGER.info("VOTING CONFIG updated by={} cadence={} scriptMinutes={} clipMinutes={} day={} hour={} delay={}s minScripts={}",
                updated.updatedBy(), updated.cadence(), updated.scriptVotingDurationMinutes(), updated.clipVotingDurationMinutes(),
                updated.startDayOfWeek(), updated.startHourUtc(), updated.immediateStartDelaySeconds(), updated.minScriptsForVoting());
        return updated;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
