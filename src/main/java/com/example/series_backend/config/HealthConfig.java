package com.example.series_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(@Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin) {
        return () -> {
            try {
                var p = new ProcessBuilder(ffmpegBin, "-version").redirectErrorStream(true).start();
                if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                    return Health.up().withDetail("ffmpeg", "ok").build();
                }
                p.destroyForcibly();
                return Health.down().withDetail("ffmpeg", "exit " + (p.isAlive() ? "timeout" : p.exitValue())).build();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Health.down(e).withDetail("ffmpeg", "interrupted").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("ffmpeg", "missing").build();
            }
        };
    }
}
