package com.example.series_backend.service;

import com.example.series_backend.dto.EpisodeContext;
import com.example.series_backend.dto.FinalizeResult;
import com.example.series_backend.engine.Interfaces.MediaFetcher;
import com.example.series_backend.engine.Interfaces.MediaMuxer;
import com.example.series_backend.exception.FinalizationException;
import com.example.series_backend.repository.EpisodeRepository;
import com.example.series_backend.service.Interfaces.ObjectStore;
import com.example.series_backend.util.EpisodeStatus;
import com.example.series_backend.util.FinalizeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Muxes the selected clip with its narration into {@code episodes/{id}/final.mp4} and points the
 * episode at the result. Running it again on a finalized episode is a no-op.
 */
@Service
public class EpisodeFinalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(EpisodeFinalizer.class);

    private final EpisodeService episodes;
    private final EpisodeRepository episodeRepo;
    private final ObjectStore store;
    private final MediaFetcher fetcher;
    private final MediaMuxer muxer;
    private final Path workDir;

    public EpisodeFinalizer(EpisodeService episodes, EpisodeRepository episodeRepo, @Nullable ObjectStore store,
                            MediaFetcher fetcher, MediaMuxer muxer,
                            @Value("${finalizer.work-dir:./data/work}") String workDir) {
        this.episodes = episodes;
        this.episodeRepo = episodeRepo;
        this.store = store;
        this.fetcher = fetcher;
        this.muxer = muxer;
        this.workDir = Path.of(workDir).toAbsolutePath().normalize();
    }

    public FinalizeResult finalizeEpisode(UUID episodeId) {
        Optional<EpisodeContext> found = episodes.findContext(episodeId);
        if (found.isEmpty()) {
            return FinalizeResult.skipped(episodeId, "episode_not_found");
        }
        EpisodeContext ctx = found.get();
        if (ctx.status() != EpisodeStatus.CLIP_SELECTED || ctx.videoUrl() == null) {
            return FinalizeResult.skipped(episodeId, "missing_selected_video_url");
        }
        if (ctx.ttsAudioUrl() == null) {
            return FinalizeResult.skipped(episodeId, "missing_tts_audio_url");
        }
        String key = finalKey(episodeId);
        if (ctx.videoUrl().contains(key)) {
            return FinalizeResult.skipped(episodeId, "already_finalized");
        }
        if (store == null) {
            return FinalizeResult.skipped(episodeId, "storage_not_configured");
        }

        long t0 = System.nanoTime();
        Path scratch = null;
        try {
            Files.createDirectories(workDir);
            scratch = Files.createTempDirectory(workDir, "finalize-");
            Path video = scratch.resolve("video.mp4");
            Path audio = scratch.resolve("narration.audio");
            Path output = scratch.resolve("final.mp4");
            Files.write(video, fetcher.fetch(ctx.videoUrl()).bytes());
            Files.write(audio, fetcher.fetch(ctx.ttsAudioUrl()).bytes());

            muxer.mux(video, audio, output);

            byte[] bytes = Files.readAllBytes(output);
            if (bytes.length == 0) {
                throw new FinalizationException("Muxer produced an empty file for episode " + episodeId);
            }
            ObjectStore.StoredObject stored = store.put(key, bytes, "video/mp4",
                    Map.of("episodeId", episodeId.toString(), "kind", "final"));
            episodes.replaceVideo(episodeId, stored.url());
            LOGGER.info("FINALIZE OK episodeId={} key={} bytes={} in={}ms",
                    episodeId, key, bytes.length, (System.nanoTime() - t0) / 1_000_000);
            return FinalizeResult.completed(episodeId, stored.url(), key);
        } catch (IOException e) {
            throw new FinalizationException("Finalize I/O failed for episode " + episodeId, e);
        } catch (FinalizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FinalizationException("Finalize failed for episode " + episodeId + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(scratch);
        }
    }

    /**
     * Finalizes up to {@code limit} selected episodes that have narration but no final cut yet.
     *
     * @return number of episodes finalized.
     */
    public int finalizePending(int limit) {
        if (limit <= 0) {
            return 0;
        }
        List<UUID> ids = episodeRepo.findFinalizationCandidates(EpisodeStatus.CLIP_SELECTED, PageRequest.of(0, limit));
        int done = 0;
        for (UUID id : ids) {
            try {
                if (finalizeEpisode(id).status() == FinalizeStatus.COMPLETED) {
                    done++;
                }
            } catch (FinalizationException e) {
                LOGGER.warn("FINALIZE FAIL episodeId={} err={}", id, e.getMessage());
            }
        }
        return done;
    }

    public static String finalKey(UUID episodeId) {
        return "episodes/" + episodeId + "/final.mp4";
    }

    private static void deleteQuietly(@Nullable Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LOGGER.debug("Scratch cleanup failed path={} err={}", p, e.toString());
                }
            });
        } catch (IOException e) {
            LOGGER.debug("Scratch cleanup failed dir={} err={}", dir, e.toString());
        }
    }
}
