package com.example.series_backend.engine.Interfaces;

/**
 * Turns a text prompt into a short video clip.
 */
public interface VideoGenerator {

    /**
     * @throws com.example.series_backend.exception.GenerationException on network, quota or prompt errors.
     */
    Result generate(Request request);

    record Request(String prompt, int width, int height, Long seed, String narrationText) {}

    record Result(byte[] mediaBytes, Long seed, String model, Double durationSeconds) {}
}
