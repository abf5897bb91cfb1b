package com.example.series_backend.engine.Interfaces;

import java.nio.file.Path;

/**
 * Combines a video track with a narration track into a single file.
 */
public interface MediaMuxer {

    /**
     * @throws com.example.series_backend.exception.FinalizationException when the muxer exits non-zero or times out.
     */
    void mux(Path video, Path audio, Path output);
}
