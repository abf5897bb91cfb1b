package com.example.series_backend.util;

import java.util.Locale;

public enum VotingCadence {
    WEEKLY,
    DAILY,
    IMMEDIATE;

    /**
     * Lenient parse used for runtime overrides; unknown values yield {@code null}.
     */
    public static VotingCadence parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return VotingCadence.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
