package com.example.series_backend.util;

public enum VoterKind {
    AGENT, HUMAN
}
