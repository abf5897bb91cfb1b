package com.example.series_backend.config;

import com.example.series_backend.util.VotingCadence;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Start-up defaults for the voting schedule. Runtime changes go through
 * {@link com.example.series_backend.service.VotingRuntimeConfigService} and are not written back.
 */
@ConfigurationProperties(prefix = "voting")
public class VotingProperties {

    private VotingCadence cadence = VotingCadence.WEEKLY;
    private int scriptVotingDurationMinutes = 1440;
    private int clipVotingDurationMinutes = 2880;
    private int startDayOfWeek = 1;
    private int startHourUtc = 0;
    private int immediateStartDelaySeconds = 5;
    private int minScriptsForVoting = 1;

    public VotingCadence getCadence() { return cadence; }
    public void setCadence(VotingCadence cadence) { this.cadence = cadence; }

    public int getScriptVotingDurationMinutes() { return scriptVotingDurationMinutes; }
    public void setScriptVotingDurationMinutes(int scriptVotingDurationMinutes) { this.scriptVotingDurationMinutes = scriptVotingDurationMinutes; }

    public int getClipVotingDurationMinutes() { return clipVotingDurationMinutes; }
    public void setClipVotingDurationMinutes(int clipVotingDurationMinutes) { this.clipVotingDurationMinutes = clipVotingDurationMinutes; }

    public int getStartDayOfWeek() { return startDayOfWeek; }
    public void setStartDayOfWeek(int startDayOfWeek) { this.startDayOfWeek = startDayOfWeek; }

    public int getStartHourUtc() { return startHourUtc; }
    public void setStartHourUtc(int startHourUtc) { this.startHourUtc = startHourUtc; }

    public int getImmediateStartDelaySeconds() { return immediateStartDelaySeconds; }
    public void setImmediateStartDelaySeconds(int immediateStartDelaySeconds) { this.immediateStartDelaySeconds = immediateStartDelaySeconds; }

    public int getMinScriptsForVoting() { return minScriptsForVoting; }
    public void setMinScriptsForVoting(int minScriptsForVoting) { this.minScriptsForVoting = minScriptsForVoting; }
}
