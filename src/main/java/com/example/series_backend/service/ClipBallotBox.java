package com.example.series_backend.service;

import com.example.series_backend.dto.ClipTally;
import com.example.series_backend.dto.ClipVariantView;
import com.example.series_backend.dto.ClipVoteResult;
import com.example.series_backend.model.ClipVariant;
import com.example.series_backend.model.ClipVote;
import com.example.series_backend.model.Episode;
import com.example.series_backend.repository.ClipVariantRepository;
import com.example.series_backend.repository.ClipVoteRepository;
import com.example.series_backend.repository.EpisodeRepository;
import com.example.series_backend.util.ClipVoteAction;
import com.example.series_backend.util.EpisodeStatus;
import com.example.series_backend.util.VariantStatus;
import com.example.series_backend.util.VoterKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Pilot clip voting. Each voter holds at most one vote per episode; voting for another variant
 * moves that vote.
 */
@Service
public class ClipBallotBox {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClipBallotBox.class);

    private final ClipVariantRepository variantRepo;
    private final ClipVoteRepository voteRepo;
    private final EpisodeRepository episodeRepo;
    private final SeriesStateReconciler reconciler;
    private final TransactionTemplate tx;
    private final Clock clock;

    public ClipBallotBox(ClipVariantRepository variantRepo, ClipVoteRepository voteRepo, EpisodeRepository episodeRepo,
                         SeriesStateReconciler reconciler, TransactionTemplate tx, Clock clock) {
        this.variantRepo = variantRepo;
        this.voteRepo = voteRepo;
        this.episodeRepo = episodeRepo;
        this.reconciler = reconciler;
        this.tx = tx;
        this.clock = clock;
    }

    @Transactional
    public ClipVoteResult castVote(UUID variantId, VoterKind voterKind, String voterId) {
        ClipVariant variant = variantRepo.findById(variantId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "CLIP_VARIANT_NOT_FOUND"));
        Episode episode = variant.getEpisode();
        Instant now = clock.instant();
        if (episode.getStatus() != EpisodeStatus.CLIP_VOTING
                || (episode.getClipVotingEndsAt() != null && !now.isBefore(episode.getClipVotingEndsAt()))) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "CLIP_VOTING_CLOSED");
        }
        if (variant.getStatus() != VariantStatus.COMPLETED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "CLIP_VARIANT_NOT_VOTABLE");
        }
        UUID episodeId = episode.getId();

        var existing = voteRepo.findByEpisodeIdAndVoterKindAndVoterId(episodeId, voterKind, voterId);
        if (existing.isPresent() && existing.get().getVariant().getId().equals(variantId)) {
            return new ClipVoteResult(ClipVoteAction.UNCHANGED, episodeId, variantId, variant.getVoteCount(), null);
        }

        UUID previous = null;
        if (existing.isPresent()) {
            previous = existing.get().getVariant().getId();
            voteRepo.delete(existing.get());
            voteRepo.flush();
            variantRepo.applyVoteDelta(previous, -1);
        }
        try {
            voteRepo.saveAndFlush(new ClipVote(variantRepo.getReferenceById(variantId), episodeId, voterKind, voterId));
        } catch (DataIntegrityViolationException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "VOTE_CONFLICT", e);
        }
        variantRepo.applyVoteDelta(variantId, 1);

        int count = variantRepo.findById(variantId).orElseThrow().getVoteCount();
        ClipVoteAction action = previous == null ? ClipVoteAction.CREATED : ClipVoteAction.TRANSFERRED;
        LOGGER.debug("CLIP VOTE episodeId={} variantId={} voter={}:{} action={} voteCount={}",
                episodeId, variantId, voterKind, voterId, action, count);
        return new ClipVoteResult(action, episodeId, variantId, count, previous);
    }

    /**
     * Picks the completed variant with the most votes, lower variant number first on ties, and
     * makes its video the episode's video.
     */
    @Transactional
    public ClipTally closeAndSelectWinner(UUID episodeId) {
        return select(episodeId, false);
    }

    /**
     * Closes every episode whose clip voting window has ended. An episode without any completed
     * variant is marked FAILED.
     *
     * @return number of episodes closed.
     */
    public int closeExpiredClipVoting() {
        List<UUID> ids = episodeRepo.findExpiredClipVotingIds(clock.instant());
        int closed = 0;
        for (UUID id : ids) {
            try {
                ClipTally tally = tx.execute(status -> select(id, true));
                if (tally != null) {
                    closed++;
                    reconciler.reconcile(tally.seriesId());
                }
            } catch (RuntimeException e) {
                LOGGER.warn("CLIP VOTING CLOSE FAIL episodeId={} err={}", id, e.toString());
            }
        }
        return closed;
    }

    @Transactional(readOnly = true)
    public List<ClipVariantView> listVariants(UUID episodeId) {
        if (!episodeRepo.existsById(episodeId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "EPISODE_NOT_FOUND");
        }
        return variantRepo.findByEpisodeIdOrderByVariantNumberAsc(episodeId).stream()
                .map(ClipVariantView::from)
                .toList();
    }

    private ClipTally select(UUID episodeId, boolean failWhenEmpty) {
        Episode episode = episodeRepo.findByIdWithSeries(episodeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "EPISODE_NOT_FOUND"));
        if (episode.getStatus() != EpisodeStatus.CLIP_VOTING) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "CLIP_VOTING_NOT_OPEN");
        }
        List<ClipVariant> ranked = variantRepo.findRanked(episodeId, VariantStatus.COMPLETED).stream()
                .filter(v -> v.getVideoUrl() != null)
                .toList();
        UUID seriesId = episode.getSeries().getId();
        if (ranked.isEmpty()) {
            if (failWhenEmpty) {
                episode.setStatus(EpisodeStatus.FAILED);
                episode.setClipVotingEndsAt(null);
                LOGGER.warn("CLIP VOTING CLOSED episodeId={} no completed variants, episode failed", episodeId);
                return new ClipTally(episodeId, seriesId, null, null, List.of());
            }
            throw new ResponseStatusException(HttpStatus.CONFLICT, "NO_CLIP_VARIANTS");
        }

        ClipVariant winner = ranked.get(0);
        for (ClipVariant v : ranked) {
            v.setSelected(v == winner);
        }
        episode.setVideoUrl(winner.getVideoUrl());
        episode.setStatus(EpisodeStatus.CLIP_SELECTED);
        episode.setClipVotingEndsAt(null);

        LOGGER.info("CLIP WINNER episodeId={} variant={} votes={}", episodeId, winner.getVariantNumber(), winner.getVoteCount());
        return new ClipTally(episodeId, seriesId, winner.getId(), winner.getVideoUrl(), ranked.stream()
                .map(v -> new ClipTally.VariantTally(v.getId(), v.getVariantNumber(), v.getVoteCount()))
                .toList());
    }
}
