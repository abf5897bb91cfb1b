package com.example.series_backend.config;

import com.example.series_backend.util.StuckJobPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "production")
public class ProductionProperties {

    private int episodesPerSeries = 5;
    private int pilotVariantCount = 4;
    private int maxAttempts = 3;
    private int pilotPriority = 100;
    private int episodePriority = 50;
    private int videoWidth = 1280;
    private int videoHeight = 704;
    private int narrationTimeoutSeconds = 120;
    private int maxBackoffMinutes = 30;
    private int stuckJobThresholdMinutes = 30;
    private StuckJobPolicy stuckJobPolicy = StuckJobPolicy.FAIL;
    private int lastErrorMaxLength = 2000;
    private int variantErrorMaxLength = 1000;

    public int getEpisodesPerSeries() { return episodesPerSeries; }
    public void setEpisodesPerSeries(int episodesPerSeries) { this.episodesPerSeries = episodesPerSeries; }

    public int getPilotVariantCount() { return pilotVariantCount; }
    public void setPilotVariantCount(int pilotVariantCount) { this.pilotVariantCount = pilotVariantCount; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public int getPilotPriority() { return pilotPriority; }
    public void setPilotPriority(int pilotPriority) { this.pilotPriority = pilotPriority; }

    public int getEpisodePriority() { return episodePriority; }
    public void setEpisodePriority(int episodePriority) { this.episodePriority = episodePriority; }

    public int getVideoWidth() { return videoWidth; }
    public void setVideoWidth(int videoWidth) { this.videoWidth = videoWidth; }

    public int getVideoHeight() { return videoHeight; }
    public void setVideoHeight(int videoHeight) { this.videoHeight = videoHeight; }

    public int getNarrationTimeoutSeconds() { return narrationTimeoutSeconds; }
    public void setNarrationTimeoutSeconds(int narrationTimeoutSeconds) { this.narrationTimeoutSeconds = narrationTimeoutSeconds; }

    public int getMaxBackoffMinutes() { return maxBackoffMinutes; }
    public void setMaxBackoffMinutes(int maxBackoffMinutes) { this.maxBackoffMinutes = maxBackoffMinutes; }

    public int getStuckJobThresholdMinutes() { return stuckJobThresholdMinutes; }
    public void setStuckJobThresholdMinutes(int stuckJobThresholdMinutes) { this.stuckJobThresholdMinutes = stuckJobThresholdMinutes; }

    public StuckJobPolicy getStuckJobPolicy() { return stuckJobPolicy; }
    public void setStuckJobPolicy(StuckJobPolicy stuckJobPolicy) { this.stuckJobPolicy = stuckJobPolicy; }

    public int getLastErrorMaxLength() { return lastErrorMaxLength; }
    public void setLastErrorMaxLength(int lastErrorMaxLength) { this.lastErrorMaxLength = lastErrorMaxLength; }

    public int getVariantErrorMaxLength() { return variantErrorMaxLength; }
    public void setVariantErrorMaxLength(int variantErrorMaxLength) { this.variantErrorMaxLength = variantErrorMaxLength; }
}
