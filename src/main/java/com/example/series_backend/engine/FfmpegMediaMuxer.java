package com.example.series_backend.engine;

import com.example.series_backend.engine.Interfaces.MediaMuxer;
import com.example.series_backend.exception.FinalizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Muxes narration onto a video with ffmpeg. Video is stream-copied, audio is re-encoded to AAC
 * and the output is cut to the shorter of the two tracks.
 */
public class FfmpegMediaMuxer implements MediaMuxer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaMuxer.class);
    private static final int LOG_SNIPPET_MAX = 2000;

    private final String ffmpegBin;
    private final Duration timeout;

    public FfmpegMediaMuxer(String ffmpegBin, Duration timeout) {
        this.ffmpegBin = ffmpegBin;
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(2);
    }

    List<String> buildCommand(Path video, Path audio, Path output) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBin);
        cmd.add("-y");
        cmd.add("-i"); cmd.add(video.toAbsolutePath().toString());
        cmd.add("-i"); cmd.add(audio.toAbsolutePath().toString());
        cmd.add("-c:v"); cmd.add("copy");
        cmd.add("-c:a"); cmd.add("aac");
        cmd.add("-b:a"); cmd.add("192k");
        cmd.add("-shortest");
        cmd.add("-movflags"); cmd.add("+faststart");
        cmd.add(output.toAbsolutePath().toString());
        return cmd;
    }

    @Override
    public void mux(Path video, Path audio, Path output) {
        if (!Files.exists(video) || !Files.exists(audio)) {
            throw new FinalizationException("Mux input missing video=" + video + " audio=" + audio);
        }
        List<String> cmd = buildCommand(video, audio, output);
        LOGGER.debug("ffmpeg mux cmd={}", cmd);

        long t0 = System.nanoTime();
        Process p;
        try {
            p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new FinalizationException("ffmpeg could not be started: " + ffmpegBin, e);
        }

        StringJoiner log = new StringJoiner(System.lineSeparator());
        Thread reader = new Thread(() -> {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    synchronized (log) {
                        log.add(line);
                    }
                }
            } catch (IOException e) {
                LOGGER.debug("ffmpeg log stream closed: {}", e.toString());
            }
        }, "ffmpeg-mux-log");
        reader.start();

        try {
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                p.waitFor(5, TimeUnit.SECONDS);
                reader.join(1000);
                throw new FinalizationException("ffmpeg mux timed out after " + timeout.toSeconds() + "s");
            }
            reader.join(1000);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new FinalizationException("ffmpeg mux interrupted", e);
        }

        if (p.exitValue() != 0 || !Files.exists(output)) {
            String out;
            synchronized (log) {
                out = log.toString();
            }
            throw new FinalizationException("ffmpeg mux failed with exit " + p.exitValue() + ": " + truncate(out));
        }
        LOGGER.info("ffmpeg mux OK output={} in={}ms", output, (System.nanoTime() - t0) / 1_000_000);
    }

    private static String truncate(String s) {
        if (s == null || s.isBlank()) return "<no output>";
        return s.length() <= LOG_SNIPPET_MAX ? s : s.substring(s.length() - LOG_SNIPPET_MAX);
    }
}
