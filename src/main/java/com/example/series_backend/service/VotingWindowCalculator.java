package com.example.series_backend.service;

import com.example.series_backend.dto.VotingRuntimeConfig;
import com.example.series_backend.dto.VotingWindow;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Cadence arithmetic for voting periods. All computations are in UTC.
 */
public final class VotingWindowCalculator {

    private VotingWindowCalculator() {
    }

    public static VotingWindow computeNextWindow(VotingRuntimeConfig config, Instant now) {
        Instant start = switch (config.cadence()) {
            case IMMEDIATE -> now.plusSeconds(config.immediateStartDelaySeconds());
            case DAILY -> nextDailyStart(now, config.startHourUtc());
            case WEEKLY -> nextWeeklyStart(now, config.startDayOfWeek(), config.startHourUtc());
        };
        return new VotingWindow(start, start.plus(Duration.ofMinutes(config.scriptVotingDurationMinutes())));
    }

    /**
     * Today's slot if it is still ahead, otherwise tomorrow's.
     */
    static Instant nextDailyStart(Instant now, int hourUtc) {
        ZonedDateTime candidate = atHour(now, hourUtc);
        if (!candidate.toInstant().isAfter(now)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }

    /**
     * Next occurrence of the weekday slot. A slot that already started today, or starts exactly
     * now, rolls over to next week.
     *
     * @param dayOfWeek 0 = Sunday .. 6 = Saturday.
     */
    static Instant nextWeeklyStart(Instant now, int dayOfWeek, int hourUtc) {
        ZonedDateTime today = atHour(now, hourUtc);
        int currentDay = today.getDayOfWeek().getValue() % 7;
        int daysUntil = dayOfWeek - currentDay;
        if (daysUntil < 0 || (daysUntil == 0 && !today.toInstant().isAfter(now))) {
            daysUntil += 7;
        }
        return today.plusDays(daysUntil).toInstant();
    }

    private static ZonedDateTime atHour(Instant now, int hourUtc) {
        return now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).withHour(hourUtc);
    }
}
