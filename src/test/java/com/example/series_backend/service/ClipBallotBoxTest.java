package com.example.series_backend.service;

import com.example.series_backend.dto.ClipTally;
import com.example.series_backend.dto.ClipVoteResult;
import com.example.series_backend.model.ClipVariant;
import com.example.series_backend.model.Episode;
import com.example.series_backend.model.Series;
import com.example.series_backend.repository.ClipVariantRepository;
import com.example.series_backend.repository.ClipVoteRepository;
import com.example.series_backend.repository.EpisodeRepository;
import com.example.series_backend.repository.SeriesRepository;
import com.example.series_backend.util.ClipVoteAction;
import com.example.series_backend.util.EpisodeStatus;
import com.example.series_backend.util.SeriesStatus;
import com.example.series_backend.util.VariantStatus;
import com.example.series_backend.util.VoterKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@Import({ClipBallotBox.class, SeriesStateReconciler.class, ServiceTestConfig.class})
class ClipBallotBoxTest {

    @Autowired private ClipBallotBox ballotBox;
    @Autowired private SeriesRepository seriesRepo;
    @Autowired private EpisodeRepository episodeRepo;
    @Autowired private ClipVariantRepository variantRepo;
    @Autowired private ClipVoteRepository voteRepo;
    @Autowired private MutableClock clock;

    private UUID seriesId;
    private UUID episodeId;
    private UUID v1;
    private UUID v2;
    private UUID v3;
    private UUID failedVariant;

    @BeforeEach
    void setUp() {
        clock.set(ServiceTestConfig.NOW);
        Series series = new Series(UUID.randomUUID(), "Salt Lines");
        series.setStatus(SeriesStatus.PRODUCING);
        series = seriesRepo.saveAndFlush(series);
        seriesId = series.getId();

        Episode pilot = new Episode(series, 1, "Salt Lines - Pilot");
        pilot.setStatus(EpisodeStatus.CLIP_VOTING);
        pilot.setClipVotingEndsAt(ServiceTestConfig.NOW.plus(Duration.ofHours(1)));
        pilot = episodeRepo.saveAndFlush(pilot);
        episodeId = pilot.getId();

        v1 = variant(pilot, 1, VariantStatus.COMPLETED);
        v2 = variant(pilot, 2, VariantStatus.COMPLETED);
        v3 = variant(pilot, 3, VariantStatus.COMPLETED);
        failedVariant = variant(pilot, 4, VariantStatus.FAILED);
    }

    @Test
    void firstVoteIsCreatedAndRepeatIsUnchanged() {
        ClipVoteResult first = ballotBox.castVote(v1, VoterKind.HUMAN, "viewer-1");
        ClipVoteResult repeat = ballotBox.castVote(v1, VoterKind.HUMAN, "viewer-1");

        assertEquals(ClipVoteAction.CREATED, first.action());
        assertEquals(1, first.voteCount());
        assertEquals(ClipVoteAction.UNCHANGED, repeat.action());
        assertEquals(1, variantRepo.findById(v1).orElseThrow().getVoteCount());
    }

    @Test
    void votingForAnotherVariantMovesTheVote() {
        ballotBox.castVote(v1, VoterKind.AGENT, "agent-7");

        ClipVoteResult moved = ballotBox.castVote(v2, VoterKind.AGENT, "agent-7");

        assertEquals(ClipVoteAction.TRANSFERRED, moved.action());
        assertEquals(v1, moved.previousVariantId());
        assertEquals(0, variantRepo.findById(v1).orElseThrow().getVoteCount());
        assertEquals(1, variantRepo.findById(v2).orElseThrow().getVoteCount());
        assertEquals(1, voteRepo.countByEpisodeId(episodeId));
        assertEquals(voteRepo.countByEpisodeId(episodeId), variantRepo.sumVotesByEpisodeId(episodeId));
    }

    @Test
    void voterKindsAreSeparateVoters() {
        ballotBox.castVote(v1, VoterKind.AGENT, "same-id");
        ballotBox.castVote(v1, VoterKind.HUMAN, "same-id");

        assertEquals(2, variantRepo.findById(v1).orElseThrow().getVoteCount());
    }

    @Test
    void votingAfterTheWindowIsClosed() {
        clock.advance(Duration.ofHours(2));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ballotBox.castVote(v1, VoterKind.HUMAN, "late"));

        assertEquals(HttpStatus.CONFLICT, ex.getStatusCode());
        assertEquals("CLIP_VOTING_CLOSED", ex.getReason());
    }

    @Test
    void failedVariantCannotBeVotedFor() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ballotBox.castVote(failedVariant, VoterKind.HUMAN, "viewer-1"));

        assertEquals(HttpStatus.CONFLICT, ex.getStatusCode());
    }

    @Test
    void unknownVariantIsNotFound() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ballotBox.castVote(UUID.randomUUID(), VoterKind.HUMAN, "viewer-1"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void tieGoesToTheLowerVariantNumber() {
        ballotBox.castVote(v3, VoterKind.HUMAN, "a");
        ballotBox.castVote(v2, VoterKind.HUMAN, "b");

        ClipTally tally = ballotBox.closeAndSelectWinner(episodeId);

        assertEquals(v2, tally.winnerVariantId());
        assertThat(tally.variants()).extracting(ClipTally.VariantTally::variantId).containsExactly(v2, v3, v1);
        Episode episode = episodeRepo.findById(episodeId).orElseThrow();
        assertEquals(EpisodeStatus.CLIP_SELECTED, episode.getStatus());
        assertEquals(url(2), episode.getVideoUrl());
        assertNull(episode.getClipVotingEndsAt());
        assertThat(variantRepo.findById(v2).orElseThrow().isSelected()).isTrue();
        assertThat(variantRepo.findById(v3).orElseThrow().isSelected()).isFalse();
    }

    @Test
    void closingWithoutCompletedVariantsIsRejected() {
        Episode other = new Episode(seriesRepo.findById(seriesId).orElseThrow(), 2, "Empty");
        other.setStatus(EpisodeStatus.CLIP_VOTING);
        UUID otherId = episodeRepo.saveAndFlush(other).getId();

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ballotBox.closeAndSelectWinner(otherId));

        assertEquals("NO_CLIP_VARIANTS", ex.getReason());
    }

    @Test
    void expiredWindowsCloseAndTheSeriesBecomesActive() {
        ballotBox.castVote(v3, VoterKind.HUMAN, "a");
        clock.advance(Duration.ofHours(2));

        int closed = ballotBox.closeExpiredClipVoting();

        assertEquals(1, closed);
        Episode episode = episodeRepo.findById(episodeId).orElseThrow();
        assertEquals(EpisodeStatus.CLIP_SELECTED, episode.getStatus());
        assertEquals(url(3), episode.getVideoUrl());
        Series series = seriesRepo.findById(seriesId).orElseThrow();
        assertEquals(SeriesStatus.ACTIVE, series.getStatus());
        assertEquals(1, series.getEpisodeCount());
    }

    @Test
    void listsVariantsInOrder() {
        List<UUID> ids = ballotBox.listVariants(episodeId).stream().map(v -> v.id()).toList();

        assertThat(ids).containsExactly(v1, v2, v3, failedVariant);
    }

    private UUID variant(Episode episode, int n, VariantStatus status) {
        ClipVariant variant = new ClipVariant(episode, n);
        variant.setStatus(status);
        variant.setVideoUrl(status == VariantStatus.COMPLETED ? url(n) : null);
        return variantRepo.saveAndFlush(variant).getId();
    }

    private static String url(int n) {
        return "https://cdn.example.com/variant-" + n + ".mp4";
    }
}
