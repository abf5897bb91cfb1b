package com.example.series_backend.service;

import com.example.series_backend.dto.PeriodTally;
import com.example.series_backend.dto.ScriptVoteResult;
import com.example.series_backend.dto.VoteBreakdown;
import com.example.series_backend.model.Script;
import com.example.series_backend.model.ScriptVote;
import com.example.series_backend.model.VotingPeriod;
import com.example.series_backend.repository.ScriptRepository;
import com.example.series_backend.repository.ScriptVoteRepository;
import com.example.series_backend.repository.VotingPeriodRepository;
import com.example.series_backend.util.ScriptStatus;
import com.example.series_backend.util.ScriptVoteAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One up or down vote per (script, voter). The script's tallies always equal the signed sum of
 * its vote rows; every change to a row moves the counters in the same transaction.
 */
@Service
public class ScriptBallotBox {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptBallotBox.class);

    private final ScriptRepository scriptRepo;
    private final ScriptVoteRepository voteRepo;
    private final VotingPeriodRepository periodRepo;

    public ScriptBallotBox(ScriptRepository scriptRepo, ScriptVoteRepository voteRepo, VotingPeriodRepository periodRepo) {
        this.scriptRepo = scriptRepo;
        this.voteRepo = voteRepo;
        this.periodRepo = periodRepo;
    }

    /**
     * Casts, swaps or toggles off a vote.
     *
     * @param value +1 or -1.
     * @return the action taken and the script's tallies afterwards.
     */
    @Transactional
    public ScriptVoteResult castVote(UUID scriptId, String voterId, int value) {
        if (value != 1 && value != -1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_VOTE_VALUE");
        }
        Script script = openScript(scriptId, voterId);

        var existing = voteRepo.findByScriptIdAndVoterId(scriptId, voterId);
        ScriptVoteAction action;
        Integer resulting;
        if (existing.isPresent() && existing.get().getValue() == value) {
            voteRepo.delete(existing.get());
            applyDelta(scriptId, -value, value > 0 ? -1 : 0, value < 0 ? -1 : 0);
            action = ScriptVoteAction.REMOVED;
            resulting = null;
        } else if (existing.isPresent()) {
            int old = existing.get().getValue();
            existing.get().setValue(value);
            // old and new differ, so one side loses a vote and the other gains one
            applyDelta(scriptId, value - old, value > 0 ? 1 : -1, value < 0 ? 1 : -1);
            action = ScriptVoteAction.UPDATED;
            resulting = value;
        } else {
            try {
                voteRepo.saveAndFlush(new ScriptVote(script, voterId, value));
            } catch (DataIntegrityViolationException e) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "VOTE_CONFLICT", e);
            }
            applyDelta(scriptId, value, value > 0 ? 1 : 0, value < 0 ? 1 : 0);
            action = ScriptVoteAction.CREATED;
            resulting = value;
        }

        Script fresh = scriptRepo.findById(scriptId).orElseThrow();
        LOGGER.debug("SCRIPT VOTE scriptId={} voter={} action={} voteCount={}", scriptId, voterId, action, fresh.getVoteCount());
        return new ScriptVoteResult(scriptId, action, resulting, fresh.getVoteCount(), fresh.getUpvotes(), fresh.getDownvotes());
    }

    /**
     * Withdraws a voter's vote, reversing its contribution.
     */
    @Transactional
    public ScriptVoteResult removeVote(UUID scriptId, String voterId) {
        openScript(scriptId, voterId);
        ScriptVote vote = voteRepo.findByScriptIdAndVoterId(scriptId, voterId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "VOTE_NOT_FOUND"));
        int value = vote.getValue();
        voteRepo.delete(vote);
        applyDelta(scriptId, -value, value > 0 ? -1 : 0, value < 0 ? -1 : 0);
        Script fresh = scriptRepo.findById(scriptId).orElseThrow();
        return new ScriptVoteResult(scriptId, ScriptVoteAction.REMOVED, null, fresh.getVoteCount(), fresh.getUpvotes(), fresh.getDownvotes());
    }

    @Transactional(readOnly = true)
    public VoteBreakdown getVoteBreakdown(UUID scriptId) {
        Script script = scriptRepo.findById(scriptId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SCRIPT_NOT_FOUND"));
        return new VoteBreakdown(scriptId, script.getVoteCount(), script.getUpvotes(), script.getDownvotes(),
                voteRepo.countByScriptId(scriptId));
    }

    /**
     * Closes a voting period: ranks its scripts, marks the first one selected and the rest
     * rejected, and flags the period as processed.
     *
     * @return the ranking; {@code winnerScriptId} is null for a period without scripts.
     */
    @Transactional
    public PeriodTally closeAndSelectWinner(UUID periodId) {
        VotingPeriod period = periodRepo.findById(periodId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "VOTING_PERIOD_NOT_FOUND"));

        List<Script> ranked = scriptRepo.findRankedByPeriod(periodId).stream()
                .filter(s -> s.getStatus() == ScriptStatus.VOTING)
                .toList();

        UUID winnerId = null;
        long totalVotes = 0;
        List<PeriodTally.RankedScript> rows = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            Script s = ranked.get(i);
            if (i == 0) {
                s.setStatus(ScriptStatus.SELECTED);
                winnerId = s.getId();
            } else {
                s.setStatus(ScriptStatus.REJECTED);
            }
            totalVotes += s.getUpvotes() + s.getDownvotes();
            rows.add(new PeriodTally.RankedScript(s.getId(), s.getTitle(), s.getVoteCount(), s.getUpvotes(), s.getDownvotes()));
        }

        period.setActive(false);
        period.setProcessed(true);

        LOGGER.info("PERIOD CLOSED periodId={} scripts={} winner={} totalVotes={}", periodId, ranked.size(), winnerId, totalVotes);
        return new PeriodTally(periodId, winnerId, rows, totalVotes);
    }

    private Script openScript(UUID scriptId, String voterId) {
        Script script = scriptRepo.findById(scriptId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SCRIPT_NOT_FOUND"));
        if (voterId != null && voterId.equals(script.getOwnerAgentId())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "SELF_VOTE_FORBIDDEN");
        }
        if (script.getStatus() != ScriptStatus.VOTING) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "SCRIPT_NOT_OPEN_FOR_VOTING");
        }
        return script;
    }

    private void applyDelta(UUID scriptId, int voteDelta, int upDelta, int downDelta) {
        scriptRepo.applyVoteDelta(scriptId, voteDelta, upDelta, downDelta);
    }
}
