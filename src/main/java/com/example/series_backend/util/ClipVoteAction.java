package com.example.series_backend.util;

public enum ClipVoteAction {
    CREATED, TRANSFERRED, UNCHANGED
}
