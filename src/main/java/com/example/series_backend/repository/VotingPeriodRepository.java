package com.example.series_backend.repository;

import com.example.series_backend.model.VotingPeriod;
import com.example.series_backend.util.PeriodKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface VotingPeriodRepository extends JpaRepository<VotingPeriod, UUID> {

    /**
     * Periods that should be running but were never activated.
     */
    @Query("""
           select p from VotingPeriod p
           where p.kind = :kind
             and p.active = false
             and p.processed = false
             and p.startsAt <= :now
             and p.endsAt > :now
           order by p.startsAt asc
           """)
    List<VotingPeriod> findDueToOpen(@Param("kind") PeriodKind kind, @Param("now") Instant now);

    @Query("""
           select p from VotingPeriod p
           where p.kind = :kind
             and p.active = true
             and p.processed = false
             and p.endsAt <= :now
           order by p.endsAt asc
           """)
    List<VotingPeriod> findDueToClose(@Param("kind") PeriodKind kind, @Param("now") Instant now);

    boolean existsByKindAndStartsAtAfter(PeriodKind kind, Instant now);

    Optional<VotingPeriod> findFirstByKindAndActiveTrueAndProcessedFalseOrderByStartsAtDesc(PeriodKind kind);

    Optional<VotingPeriod> findFirstByKindAndStartsAtAfterOrderByStartsAtAsc(PeriodKind kind, Instant now);

    long countByKindAndProcessedTrue(PeriodKind kind);
}
