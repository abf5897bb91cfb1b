package com.example.series_backend.controller;

import com.example.series_backend.dto.ClipVariantView;
import com.example.series_backend.dto.ClipVoteResult;
import com.example.series_backend.dto.ScriptVoteResult;
import com.example.series_backend.dto.VoteBreakdown;
import com.example.series_backend.dto.VotingDashboard;
import com.example.series_backend.dto.web.ClipVoteRequest;
import com.example.series_backend.dto.web.ScriptVoteRequest;
import com.example.series_backend.service.ClipBallotBox;
import com.example.series_backend.service.ScriptBallotBox;
import com.example.series_backend.service.VotingScheduler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1")
public class VotingController {
    private final ScriptBallotBox scriptBallotBox;
    private final ClipBallotBox clipBallotBox;
    private final VotingScheduler scheduler;

    public VotingController(ScriptBallotBox scriptBallotBox, ClipBallotBox clipBallotBox, VotingScheduler scheduler) {
        this.scriptBallotBox = scriptBallotBox;
        this.clipBallotBox = clipBallotBox;
        this.scheduler = scheduler;
    }

    @PostMapping("/scripts/{id}/votes")
    public ScriptVoteResult voteScript(@PathVariable UUID id, @Valid @RequestBody ScriptVoteRequest req) {
        return scriptBallotBox.castVote(id, req.voterId(), req.value());
    }

    @DeleteMapping("/scripts/{id}/votes/{voterId}")
    public ScriptVoteResult removeScriptVote(@PathVariable UUID id, @PathVariable String voterId) {
        return scriptBallotBox.removeVote(id, voterId);
    }

    @GetMapping("/scripts/{id}/votes/breakdown")
    public VoteBreakdown breakdown(@PathVariable UUID id) {
        return scriptBallotBox.getVoteBreakdown(id);
    }

    @PostMapping("/clips/{variantId}/votes")
    public ClipVoteResult voteClip(@PathVariable UUID variantId, @Valid @RequestBody ClipVoteRequest req) {
        return clipBallotBox.castVote(variantId, req.voterKind(), req.voterId());
    }

    @GetMapping("/episodes/{id}/clips")
    public List<ClipVariantView> clips(@PathVariable UUID id) {
        return clipBallotBox.listVariants(id);
    }

    @GetMapping("/voting/periods/current")
    public ResponseEntity<VotingDashboard.PeriodSummary> currentPeriod() {
        VotingDashboard.PeriodSummary current = scheduler.getVotingDashboard().currentPeriod();
        return current == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(current);
    }
}
