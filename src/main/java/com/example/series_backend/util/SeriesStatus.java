package com.example.series_backend.util;

public enum SeriesStatus {
    PENDING, PRODUCING, ACTIVE, COMPLETED, FAILED
}
