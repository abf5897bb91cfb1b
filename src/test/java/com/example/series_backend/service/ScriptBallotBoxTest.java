package com.example.series_backend.service;

import com.example.series_backend.dto.PeriodTally;
import com.example.series_backend.dto.ScriptVoteResult;
import com.example.series_backend.model.Script;
import com.example.series_backend.model.VotingPeriod;
import com.example.series_backend.repository.ScriptRepository;
import com.example.series_backend.repository.ScriptVoteRepository;
import com.example.series_backend.repository.VotingPeriodRepository;
import com.example.series_backend.util.PeriodKind;
import com.example.series_backend.util.ScriptStatus;
import com.example.series_backend.util.ScriptVoteAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@Import(ScriptBallotBox.class)
class ScriptBallotBoxTest {

    @Autowired private ScriptBallotBox ballotBox;
    @Autowired private ScriptRepository scriptRepo;
    @Autowired private ScriptVoteRepository voteRepo;
    @Autowired private VotingPeriodRepository periodRepo;

    private VotingPeriod period;

    @BeforeEach
    void setUp() {
        Instant start = Instant.parse("2025-03-01T00:00:00Z");
        period = new VotingPeriod(PeriodKind.SCRIPT_VOTING, start, start.plus(Duration.ofDays(1)));
        period.setActive(true);
        period = periodRepo.saveAndFlush(period);
    }

    @Test
    void sameValueTwiceTogglesTheVoteOff() {
        UUID id = votingScript("owner", "Night Shift", Instant.parse("2025-03-01T01:00:00Z")).getId();

        ScriptVoteResult first = ballotBox.castVote(id, "agent-1", 1);
        assertEquals(ScriptVoteAction.CREATED, first.action());
        assertEquals(1, first.voteCount());
        assertEquals(1, first.upvotes());

        ScriptVoteResult second = ballotBox.castVote(id, "agent-1", 1);
        assertEquals(ScriptVoteAction.REMOVED, second.action());
        assertThat(second.value()).isNull();
        assertEquals(0, second.voteCount());
        assertEquals(0, second.upvotes());
        assertEquals(0, voteRepo.countByScriptId(id));
    }

    @Test
    void oppositeValueSwapsTheVote() {
        UUID id = votingScript("owner", "Night Shift", Instant.parse("2025-03-01T01:00:00Z")).getId();

        ballotBox.castVote(id, "agent-1", -1);
        ScriptVoteResult swapped = ballotBox.castVote(id, "agent-1", 1);

        assertEquals(ScriptVoteAction.UPDATED, swapped.action());
        assertEquals(1, swapped.value());
        assertEquals(1, swapped.voteCount());
        assertEquals(1, swapped.upvotes());
        assertEquals(0, swapped.downvotes());
    }

    @Test
    void countersMatchTheSumOfVoteRows() {
        UUID id = votingScript("owner", "Night Shift", Instant.parse("2025-03-01T01:00:00Z")).getId();

        ballotBox.castVote(id, "a", 1);
        ballotBox.castVote(id, "b", 1);
        ballotBox.castVote(id, "c", -1);
        ballotBox.castVote(id, "b", -1);
        ballotBox.castVote(id, "a", 1);
        ballotBox.castVote(id, "d", 1);
        ballotBox.removeVote(id, "d");

        Script script = scriptRepo.findById(id).orElseThrow();
        assertEquals(voteRepo.sumValuesByScriptId(id), script.getVoteCount());
        assertEquals(-2, script.getVoteCount());
        assertEquals(0, script.getUpvotes());
        assertEquals(2, script.getDownvotes());
    }

    @Test
    void ownerCannotVote() {
        UUID id = votingScript("owner", "Night Shift", Instant.parse("2025-03-01T01:00:00Z")).getId();

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ballotBox.castVote(id, "owner", 1));

        assertEquals(HttpStatus.FORBIDDEN, ex.getStatusCode());
        assertEquals("SELF_VOTE_FORBIDDEN", ex.getReason());
    }

    @Test
    void scriptOutsideVotingIsRejected() {
        Script script = new Script(UUID.randomUUID(), "owner", "Draft");
        script.setStatus(ScriptStatus.SUBMITTED);
        UUID id = scriptRepo.saveAndFlush(script).getId();

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ballotBox.castVote(id, "agent-1", 1));

        assertEquals(HttpStatus.CONFLICT, ex.getStatusCode());
        assertEquals("SCRIPT_NOT_OPEN_FOR_VOTING", ex.getReason());
    }

    @Test
    void voteValueMustBePlusOrMinusOne() {
        UUID id = votingScript("owner", "Night Shift", Instant.parse("2025-03-01T01:00:00Z")).getId();

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ballotBox.castVote(id, "agent-1", 2));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void removingAMissingVoteIsNotFound() {
        UUID id = votingScript("owner", "Night Shift", Instant.parse("2025-03-01T01:00:00Z")).getId();

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ballotBox.removeVote(id, "nobody"));

        assertEquals("VOTE_NOT_FOUND", ex.getReason());
    }

    @Test
    void closingRanksByVotesThenUpvotesThenSubmissionTime() {
        UUID early = votingScript("o1", "Early", Instant.parse("2025-03-01T01:00:00Z")).getId();
        UUID popular = votingScript("o2", "Popular", Instant.parse("2025-03-01T02:00:00Z")).getId();
        UUID late = votingScript("o3", "Late", Instant.parse("2025-03-01T03:00:00Z")).getId();
        UUID disliked = votingScript("o4", "Disliked", Instant.parse("2025-03-01T00:30:00Z")).getId();

        // early: +2 with 2 up; popular: +2 with 3 up and 1 down; late: +2 with 2 up
        ballotBox.castVote(early, "a", 1);
        ballotBox.castVote(early, "b", 1);
        ballotBox.castVote(popular, "a", 1);
        ballotBox.castVote(popular, "b", 1);
        ballotBox.castVote(popular, "c", 1);
        ballotBox.castVote(popular, "d", -1);
        ballotBox.castVote(late, "a", 1);
        ballotBox.castVote(late, "b", 1);
        ballotBox.castVote(disliked, "a", -1);

        PeriodTally tally = ballotBox.closeAndSelectWinner(period.getId());

        assertEquals(popular, tally.winnerScriptId());
        List<UUID> order = tally.ranked().stream().map(PeriodTally.RankedScript::scriptId).toList();
        assertThat(order).containsExactly(popular, early, late, disliked);
        assertEquals(ScriptStatus.SELECTED, scriptRepo.findById(popular).orElseThrow().getStatus());
        assertEquals(ScriptStatus.REJECTED, scriptRepo.findById(early).orElseThrow().getStatus());
        assertEquals(ScriptStatus.REJECTED, scriptRepo.findById(disliked).orElseThrow().getStatus());

        VotingPeriod closed = periodRepo.findById(period.getId()).orElseThrow();
        assertThat(closed.isProcessed()).isTrue();
        assertThat(closed.isActive()).isFalse();
    }

    @Test
    void closingAnEmptyPeriodHasNoWinner() {
        PeriodTally tally = ballotBox.closeAndSelectWinner(period.getId());

        assertThat(tally.hasWinner()).isFalse();
        assertThat(periodRepo.findById(period.getId()).orElseThrow().isProcessed()).isTrue();
    }

    private Script votingScript(String owner, String title, Instant submittedAt) {
        Script script = new Script(UUID.randomUUID(), owner, title);
        script.setStatus(ScriptStatus.VOTING);
        script.setSubmittedAt(submittedAt);
        script.setVotingPeriod(period);
        script.setVotingEndsAt(period.getEndsAt());
        return scriptRepo.saveAndFlush(script);
    }
}
