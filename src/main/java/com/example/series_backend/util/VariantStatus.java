package com.example.series_backend.util;

public enum VariantStatus {
    COMPLETED, FAILED
}
