package com.example.series_backend.repository;

import com.example.series_backend.model.Episode;
import com.example.series_backend.util.EpisodeStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EpisodeRepository extends JpaRepository<Episode, UUID> {

    List<Episode> findBySeriesIdOrderByEpisodeNumberAsc(UUID seriesId);

    Optional<Episode> findBySeriesIdAndEpisodeNumber(UUID seriesId, int episodeNumber);

    /**
     * Loads an episode together with its series.
     */
    @Query("""
           select e from Episode e
           join fetch e.series
           where e.id = :id
           """)
    Optional<Episode> findByIdWithSeries(@Param("id") UUID id);

    @Query("""
           select e.id from Episode e
           where e.status = com.example.series_backend.util.EpisodeStatus.CLIP_VOTING
             and e.clipVotingEndsAt is not null
             and e.clipVotingEndsAt <= :now
           order by e.clipVotingEndsAt asc
           """)
    List<UUID> findExpiredClipVotingIds(@Param("now") Instant now);

    /**
     * Selected episodes with a narration track whose video is not yet the canonical final cut.
     */
    @Query("""
           select e.id from Episode e
           where e.status = :status
             and e.videoUrl is not null
             and e.ttsAudioUrl is not null
             and e.videoUrl not like '%/final.mp4'
           order by e.updatedAt asc
           """)
    List<UUID> findFinalizationCandidates(@Param("status") EpisodeStatus status, Pageable pageable);
}
