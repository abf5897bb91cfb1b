package com.example.series_backend.repository;

import com.example.series_backend.model.Series;
import com.example.series_backend.util.SeriesStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SeriesRepository extends JpaRepository<Series, UUID> {

    Optional<Series> findByScriptId(UUID scriptId);

    List<Series> findByStatusInOrderByUpdatedAtAsc(Collection<SeriesStatus> statuses, Pageable pageable);
}
