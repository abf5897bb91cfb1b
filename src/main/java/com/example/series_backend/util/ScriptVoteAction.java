package com.example.series_backend.util;

public enum ScriptVoteAction {
    CREATED, UPDATED, REMOVED
}
