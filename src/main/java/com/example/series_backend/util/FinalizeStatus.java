package com.example.series_backend.util;

public enum FinalizeStatus {
    SKIPPED, COMPLETED
}
