package com.example.series_backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process trigger for the tick, for deployments without an external cron.
 */
@Component
@ConditionalOnProperty(prefix = "tick", name = "enabled", havingValue = "true")
public class TickScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(TickScheduler.class);

    private final VotingTickService tickService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TickScheduler(VotingTickService tickService) {
        this.tickService = tickService;
    }

    @Scheduled(fixedDelayString = "${tick.fixed-delay-ms:60000}", initialDelayString = "${tick.fixed-delay-ms:60000}")
    public void run() {
        if (!running.compareAndSet(false, true)) {
            LOGGER.debug("Tick still running, skipping");
            return;
        }
        try {
            tickService.tick();
        } catch (RuntimeException e) {
            LOGGER.error("Scheduled tick failed: {}", e.toString(), e);
        } finally {
            running.set(false);
        }
    }
}
