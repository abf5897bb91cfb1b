package com.example.series_backend.util;

public enum JobStatus {
    PENDING, PROCESSING, COMPLETED, FAILED
}
