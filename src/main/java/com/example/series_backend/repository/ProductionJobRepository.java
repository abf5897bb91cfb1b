package com.example.series_backend.repository;

import com.example.series_backend.model.ProductionJob;
import com.example.series_backend.util.JobStatus;
import com.example.series_backend.util.JobType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProductionJobRepository extends JpaRepository<ProductionJob, UUID> {

    Optional<ProductionJob> findByEpisodeIdAndJobType(UUID episodeId, JobType jobType);

    List<ProductionJob> findBySeriesId(UUID seriesId);

    long countByStatus(JobStatus status);

    /**
     * Pending jobs whose backoff has elapsed, in claim order.
     *
     * @param now current instant.
     * @param pageable page size bounds the batch.
     * @return job ids ordered by priority, then availability, then age.
     */
    @Query("""
           select j.id from ProductionJob j
           where j.status = com.example.series_backend.util.JobStatus.PENDING
             and j.availableAt <= :now
           order by j.priority desc, j.availableAt asc, j.createdAt asc
           """)
    List<UUID> findDueIds(@Param("now") Instant now, Pageable pageable);

    /**
     * Conditional claim. Returns 1 for the caller that moved the job out of PENDING and 0 for
     * everyone else.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update ProductionJob j
              set j.status = com.example.series_backend.util.JobStatus.PROCESSING,
                  j.startedAt = :now,
                  j.updatedAt = :now,
                  j.version = j.version + 1
            where j.id = :id
              and j.status = com.example.series_backend.util.JobStatus.PENDING
           """)
    int claim(@Param("id") UUID id, @Param("now") Instant now);

    @Query("""
           select j.id from ProductionJob j
           where j.status = com.example.series_backend.util.JobStatus.PROCESSING
             and j.startedAt < :cutoff
           order by j.startedAt asc
           """)
    List<UUID> findStuckIds(@Param("cutoff") Instant cutoff);
}
