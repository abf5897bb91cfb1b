package com.example.series_backend.repository;

import com.example.series_backend.model.ClipVariant;
import com.example.series_backend.util.VariantStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ClipVariantRepository extends JpaRepository<ClipVariant, UUID> {

    Optional<ClipVariant> findByEpisodeIdAndVariantNumber(UUID episodeId, int variantNumber);

    List<ClipVariant> findByEpisodeIdOrderByVariantNumberAsc(UUID episodeId);

    /**
     * Completed variants of an episode in winning order; lower variant numbers win ties.
     */
    @Query("""
           select v from ClipVariant v
           where v.episode.id = :episodeId
             and v.status = :status
           order by v.voteCount desc, v.variantNumber asc
           """)
    List<ClipVariant> findRanked(@Param("episodeId") UUID episodeId, @Param("status") VariantStatus status);

    @Query("select coalesce(sum(v.voteCount), 0) from ClipVariant v where v.episode.id = :episodeId")
    long sumVotesByEpisodeId(@Param("episodeId") UUID episodeId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ClipVariant v set v.voteCount = v.voteCount + :delta where v.id = :id")
    int applyVoteDelta(@Param("id") UUID id, @Param("delta") int delta);
}
