package com.example.series_backend.service;

import com.example.series_backend.dto.EnqueueResult;
import com.example.series_backend.dto.PeriodTally;
import com.example.series_backend.dto.VotingDashboard;
import com.example.series_backend.dto.VotingPeriodResult;
import com.example.series_backend.dto.VotingRuntimeConfig;
import com.example.series_backend.dto.VotingWindow;
import com.example.series_backend.model.Script;
import com.example.series_backend.model.VotingPeriod;
import com.example.series_backend.repository.ProductionJobRepository;
import com.example.series_backend.repository.ScriptRepository;
import com.example.series_backend.repository.VotingPeriodRepository;
import com.example.series_backend.util.JobStatus;
import com.example.series_backend.util.PeriodKind;
import com.example.series_backend.util.ScriptStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Opens, closes and schedules script voting periods. Every step is idempotent so the tick can
 * call it as often as it likes.
 */
@Service
public class VotingScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(VotingScheduler.class);

    private static final int RECENT_WINNERS = 5;

    private final VotingPeriodRepository periodRepo;
    private final ScriptRepository scriptRepo;
    private final ProductionJobRepository jobRepo;
    private final ScriptBallotBox ballotBox;
    private final ProductionDispatcher dispatcher;
    private final VotingRuntimeConfigService votingConfig;
    private final TransactionTemplate tx;
    private final Clock clock;

    public VotingScheduler(VotingPeriodRepository periodRepo, ScriptRepository scriptRepo,
                           ProductionJobRepository jobRepo, ScriptBallotBox ballotBox,
                           ProductionDispatcher dispatcher, VotingRuntimeConfigService votingConfig,
                           TransactionTemplate tx, Clock clock) {
        this.periodRepo = periodRepo;
        this.scriptRepo = scriptRepo;
        this.jobRepo = jobRepo;
        this.ballotBox = ballotBox;
        this.dispatcher = dispatcher;
        this.votingConfig = votingConfig;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * Activates periods whose window has started, provided enough scripts are waiting.
     *
     * @return number of periods opened.
     */
    public int openDuePeriods() {
        Instant now = clock.instant();
        int minScripts = Math.max(1, votingConfig.get().minScriptsForVoting());
        int opened = 0;
        for (VotingPeriod due : periodRepo.findDueToOpen(PeriodKind.SCRIPT_VOTING, now)) {
            UUID periodId = due.getId();
            Integer assigned = tx.execute(status -> {
                VotingPeriod period = periodRepo.findById(periodId).orElseThrow();
                List<Script> waiting = scriptRepo.findByStatusAndVotingPeriodIsNullOrderBySubmittedAtAsc(ScriptStatus.SUBMITTED);
                if (waiting.size() < minScripts) {
                    return 0;
                }
                for (Script s : waiting) {
                    s.setStatus(ScriptStatus.VOTING);
                    s.setVotingPeriod(period);
                    s.setVotingEndsAt(period.getEndsAt());
                }
                period.setActive(true);
                return waiting.size();
            });
            if (assigned != null && assigned > 0) {
                opened++;
                LOGGER.info("PERIOD OPENED periodId={} scripts={} endsAt={}", periodId, assigned, due.getEndsAt());
            } else {
                LOGGER.debug("PERIOD WAITING periodId={} need>={} scripts", periodId, minScripts);
            }
        }
        return opened;
    }

    /**
     * Tallies every period whose window has ended and hands each winner to production. Winners
     * whose dispatch failed on an earlier tick are dispatched again first.
     */
    public List<VotingPeriodResult> closeDuePeriods() {
        redispatchSelected();
        List<VotingPeriodResult> results = new ArrayList<>();
        for (VotingPeriod due : periodRepo.findDueToClose(PeriodKind.SCRIPT_VOTING, clock.instant())) {
            UUID periodId = due.getId();
            PeriodTally tally;
            try {
                tally = ballotBox.closeAndSelectWinner(periodId);
            } catch (RuntimeException e) {
                LOGGER.error("PERIOD CLOSE FAIL periodId={} err={}", periodId, e.toString(), e);
                results.add(new VotingPeriodResult(periodId, null, null, 0, e.getMessage()));
                continue;
            }
            if (!tally.hasWinner()) {
                results.add(new VotingPeriodResult(periodId, null, null, 0, null));
                continue;
            }
            try {
                EnqueueResult enqueued = dispatcher.enqueueBatch(tally.winnerScriptId());
                results.add(new VotingPeriodResult(periodId, tally.winnerScriptId(), enqueued.seriesId(), tally.ranked().size(), null));
            } catch (RuntimeException e) {
                LOGGER.error("DISPATCH FAIL periodId={} scriptId={} err={}", periodId, tally.winnerScriptId(), e.toString(), e);
                results.add(new VotingPeriodResult(periodId, tally.winnerScriptId(), null, tally.ranked().size(), e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Creates the next period from the current cadence unless one is already scheduled.
     *
     * @return true if a period was created.
     */
    @Transactional
    public boolean ensureUpcomingPeriod() {
        Instant now = clock.instant();
        if (periodRepo.existsByKindAndStartsAtAfter(PeriodKind.SCRIPT_VOTING, now)) {
            return false;
        }
        VotingRuntimeConfig config = votingConfig.get();
        VotingWindow window = VotingWindowCalculator.computeNextWindow(config, now);
        VotingPeriod period = periodRepo.save(new VotingPeriod(PeriodKind.SCRIPT_VOTING, window.startsAt(), window.endsAt()));
        LOGGER.info("PERIOD SCHEDULED periodId={} cadence={} startsAt={} endsAt={}",
                period.getId(), config.cadence(), window.startsAt(), window.endsAt());
        return true;
    }

    @Transactional(readOnly = true)
    public VotingDashboard getVotingDashboard() {
        Instant now = clock.instant();
        VotingDashboard.PeriodSummary current = periodRepo
                .findFirstByKindAndActiveTrueAndProcessedFalseOrderByStartsAtDesc(PeriodKind.SCRIPT_VOTING)
                .map(VotingScheduler::summary).orElse(null);
        VotingDashboard.PeriodSummary upcoming = periodRepo
                .findFirstByKindAndStartsAtAfterOrderByStartsAtAsc(PeriodKind.SCRIPT_VOTING, now)
                .map(VotingScheduler::summary).orElse(null);
        List<VotingDashboard.WinnerSummary> winners = scriptRepo
                .findByStatusOrderByProducedAtDesc(ScriptStatus.PRODUCED, PageRequest.of(0, RECENT_WINNERS)).stream()
                .map(s -> new VotingDashboard.WinnerSummary(s.getId(), s.getTitle(), s.getVoteCount(), s.getSeriesId(), s.getProducedAt()))
                .toList();

        long processed = periodRepo.countByKindAndProcessedTrue(PeriodKind.SCRIPT_VOTING);
        long votes = scriptRepo.sumVotesInProcessedPeriods();
        double average = processed == 0 ? 0.0 : (double) votes / processed;
        VotingDashboard.Stats stats = new VotingDashboard.Stats(
                processed,
                scriptRepo.countVotedInProcessedPeriods(),
                Math.round(average * 100.0) / 100.0,
                jobRepo.countByStatus(JobStatus.PENDING),
                jobRepo.countByStatus(JobStatus.PROCESSING));
        return new VotingDashboard(current, upcoming, winners, stats);
    }

    private void redispatchSelected() {
        for (Script s : scriptRepo.findByStatusOrderBySubmittedAtAsc(ScriptStatus.SELECTED)) {
            try {
                EnqueueResult r = dispatcher.enqueueBatch(s.getId());
                LOGGER.info("REDISPATCH scriptId={} seriesId={} jobs={}", s.getId(), r.seriesId(), r.enqueuedJobs());
            } catch (RuntimeException e) {
                LOGGER.error("REDISPATCH FAIL scriptId={} err={}", s.getId(), e.toString());
            }
        }
    }

    private static VotingDashboard.PeriodSummary summary(VotingPeriod p) {
        return new VotingDashboard.PeriodSummary(p.getId(), p.getStartsAt(), p.getEndsAt(), p.isActive());
    }
}
