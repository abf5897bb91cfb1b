package com.example.series_backend.repository;

import com.example.series_backend.model.Script;
import com.example.series_backend.util.ScriptStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface ScriptRepository extends JpaRepository<Script, UUID> {

    List<Script> findByStatusAndVotingPeriodIsNullOrderBySubmittedAtAsc(ScriptStatus status);

    long countByStatusAndVotingPeriodIsNull(ScriptStatus status);

    /**
     * Ranks the scripts of a voting period. The first row is the winner.
     *
     * @param periodId voting period identifier.
     * @return scripts ordered by vote count, then upvotes, then earliest submission.
     */
    @Query("""
           select s from Script s
           where s.votingPeriod.id = :periodId
           order by s.voteCount desc, s.upvotes desc, s.submittedAt asc, s.id asc
           """)
    List<Script> findRankedByPeriod(@Param("periodId") UUID periodId);

    List<Script> findByStatusOrderByProducedAtDesc(ScriptStatus status, Pageable pageable);

    List<Script> findByStatusOrderBySubmittedAtAsc(ScriptStatus status);

    @Query("select count(s) from Script s where s.votingPeriod is not null and s.votingPeriod.processed = true")
    long countVotedInProcessedPeriods();

    @Query("select coalesce(sum(s.upvotes + s.downvotes), 0) from Script s where s.votingPeriod is not null and s.votingPeriod.processed = true")
    long sumVotesInProcessedPeriods();

    /**
     * Applies a vote delta atomically. {@code voteDelta} is the signed change to
     * {@code vote_count}; the up/down deltas move the split counters.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update Script s
              set s.voteCount = s.voteCount + :voteDelta,
                  s.upvotes = s.upvotes + :upDelta,
                  s.downvotes = s.downvotes + :downDelta
            where s.id = :id
           """)
    int applyVoteDelta(@Param("id") UUID id,
                       @Param("voteDelta") int voteDelta,
                       @Param("upDelta") int upDelta,
                       @Param("downDelta") int downDelta);
}
