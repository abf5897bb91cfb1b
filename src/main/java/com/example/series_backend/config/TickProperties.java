package com.example.series_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tick")
public class TickProperties {

    // in-process trigger; off when an external cron calls the internal endpoint
    private boolean enabled = false;
    private long fixedDelayMs = 60_000;
    private String cronSecret;
    private boolean allowUnauthenticated = false;
    private int finalizeBatchSize = 5;
    private int reconcileBatchSize = 20;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public long getFixedDelayMs() { return fixedDelayMs; }
    public void setFixedDelayMs(long fixedDelayMs) { this.fixedDelayMs = fixedDelayMs; }

    public String getCronSecret() { return cronSecret; }
    public void setCronSecret(String cronSecret) { this.cronSecret = cronSecret; }

    public boolean isAllowUnauthenticated() { return allowUnauthenticated; }
    public void setAllowUnauthenticated(boolean allowUnauthenticated) { this.allowUnauthenticated = allowUnauthenticated; }

    public int getFinalizeBatchSize() { return finalizeBatchSize; }
    public void setFinalizeBatchSize(int finalizeBatchSize) { this.finalizeBatchSize = finalizeBatchSize; }

    public int getReconcileBatchSize() { return reconcileBatchSize; }
    public void setReconcileBatchSize(int reconcileBatchSize) { this.reconcileBatchSize = reconcileBatchSize; }
}
