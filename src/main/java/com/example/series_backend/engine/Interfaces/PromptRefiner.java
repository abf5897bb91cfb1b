package com.example.series_backend.engine.Interfaces;

public interface PromptRefiner {
    String refine(String rawPrompt);
}
