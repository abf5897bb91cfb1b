package com.example.series_backend.service;

import com.example.series_backend.dto.EpisodeContext;
import com.example.series_backend.dto.VariantWrite;
import com.example.series_backend.model.ClipVariant;
import com.example.series_backend.model.Episode;
import com.example.series_backend.repository.ClipVariantRepository;
import com.example.series_backend.repository.EpisodeRepository;
import com.example.series_backend.util.EpisodeStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Short transactional steps used by production handlers and the finalizer, which run outside
 * any transaction while they wait on remote generation.
 */
@Service
public class EpisodeService {

    private final EpisodeRepository episodeRepo;
    private final ClipVariantRepository variantRepo;
    private final ScriptDataCodec codec;

    public EpisodeService(EpisodeRepository episodeRepo, ClipVariantRepository variantRepo, ScriptDataCodec codec) {
        this.episodeRepo = episodeRepo;
        this.variantRepo = variantRepo;
        this.codec = codec;
    }

    @Transactional(readOnly = true)
    public Optional<EpisodeContext> findContext(UUID episodeId) {
        return episodeRepo.findByIdWithSeries(episodeId).map(e -> new EpisodeContext(
                e.getId(),
                e.getSeries().getId(),
                e.getEpisodeNumber(),
                e.getStatus(),
                e.getVideoUrl(),
                e.getTtsAudioUrl(),
                codec.readBrief(e.getBrief())));
    }

    public EpisodeContext loadContext(UUID episodeId) {
        return findContext(episodeId).orElseThrow(() -> new IllegalStateException("Episode not found: " + episodeId));
    }

    @Transactional
    public void markGenerating(UUID episodeId) {
        load(episodeId).setStatus(EpisodeStatus.GENERATING);
    }

    /**
     * Creates or overwrites the variant keyed by (episode, number). Vote counts are kept.
     */
    @Transactional
    public UUID upsertVariant(UUID episodeId, int variantNumber, VariantWrite write) {
        ClipVariant variant = variantRepo.findByEpisodeIdAndVariantNumber(episodeId, variantNumber)
                .orElseGet(() -> new ClipVariant(episodeRepo.getReferenceById(episodeId), variantNumber));
        variant.setStatus(write.status());
        variant.setVideoUrl(write.videoUrl());
        variant.setPrompt(write.prompt());
        variant.setAudioText(write.audioText());
        variant.setModelUsed(write.modelUsed());
        variant.setSeed(write.seed());
        variant.setDurationSeconds(write.durationSeconds());
        variant.setGenerationTimeMs(write.generationTimeMs());
        variant.setErrorMessage(write.errorMessage());
        variant.setSelected(write.selected());
        return variantRepo.save(variant).getId();
    }

    @Transactional
    public void openClipVoting(UUID episodeId, Instant endsAt) {
        Episode episode = load(episodeId);
        episode.setStatus(EpisodeStatus.CLIP_VOTING);
        episode.setClipVotingEndsAt(endsAt);
    }

    @Transactional
    public void markSelected(UUID episodeId, String videoUrl) {
        Episode episode = load(episodeId);
        episode.setStatus(EpisodeStatus.CLIP_SELECTED);
        episode.setVideoUrl(videoUrl);
        episode.setClipVotingEndsAt(null);
    }

    @Transactional
    public void attachNarration(UUID episodeId, String audioUrl) {
        load(episodeId).setTtsAudioUrl(audioUrl);
    }

    @Transactional
    public void replaceVideo(UUID episodeId, String videoUrl) {
        load(episodeId).setVideoUrl(videoUrl);
    }

    private Episode load(UUID episodeId) {
        return episodeRepo.findById(episodeId)
                .orElseThrow(() -> new IllegalStateException("Episode not found: " + episodeId));
    }
}
