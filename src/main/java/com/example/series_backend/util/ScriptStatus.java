package com.example.series_backend.util;

public enum ScriptStatus {
    DRAFT, SUBMITTED, VOTING, SELECTED, REJECTED, PRODUCED
}
