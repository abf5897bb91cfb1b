package com.example.series_backend.util;

/**
 * Shape of a production job. The pilot produces several competing variants, every other
 * episode produces exactly one variant that is selected straight away.
 */
public enum JobType {
    PILOT_VARIANTS,
    SINGLE_EPISODE
}
