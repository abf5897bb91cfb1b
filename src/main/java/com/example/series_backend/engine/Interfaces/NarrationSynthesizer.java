package com.example.series_backend.engine.Interfaces;

import java.time.Duration;

/**
 * Text-to-speech for episode narration. Blocks until the audio is ready or the timeout passes.
 */
public interface NarrationSynthesizer {

    Result synthesizeAndWait(String text, Duration timeout);

    record Result(String audioUrl, String contentType) {}
}
