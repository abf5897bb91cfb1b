package com.example.series_backend.config;

import com.example.series_backend.engine.FfmpegMediaMuxer;
import com.example.series_backend.engine.Interfaces.MediaFetcher;
import com.example.series_backend.engine.Interfaces.MediaMuxer;
import com.example.series_backend.engine.WebClientMediaFetcher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EngineConfig {

    @Bean
    public MediaMuxer mediaMuxer(
            @Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin,
            @Value("${finalizer.timeout-seconds:180}") long timeoutSeconds
    ) {
        return new FfmpegMediaMuxer(ffmpegBin, Duration.ofSeconds(Math.max(1, timeoutSeconds)));
    }

    @Bean
    public MediaFetcher mediaFetcher(@Value("${media.download.timeout-seconds:120}") long timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        return new WebClientMediaFetcher(GenerationClientConfig.webClient(null, timeout, null), timeout);
    }
}
