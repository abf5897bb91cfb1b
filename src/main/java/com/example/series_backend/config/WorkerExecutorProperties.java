package com.example.series_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures how much of the production queue one drain call may take on and how many jobs run
 * at the same time.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int maxJobsPerTick = 5;
    private int maxRuntimeSeconds = 45;
    private int maxConcurrency = 2;
    private int executorThreads = 4;
    private int executorQueueCapacity = 50;

    public int getMaxJobsPerTick() {
        return maxJobsPerTick;
    }

    public void setMaxJobsPerTick(int maxJobsPerTick) {
        this.maxJobsPerTick = maxJobsPerTick;
    }

    public int getMaxRuntimeSeconds() {
        return maxRuntimeSeconds;
    }

    public void setMaxRuntimeSeconds(int maxRuntimeSeconds) {
        this.maxRuntimeSeconds = maxRuntimeSeconds;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }
}
