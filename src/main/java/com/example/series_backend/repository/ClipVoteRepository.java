package com.example.series_backend.repository;

import com.example.series_backend.model.ClipVote;
import com.example.series_backend.util.VoterKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ClipVoteRepository extends JpaRepository<ClipVote, UUID> {

    Optional<ClipVote> findByEpisodeIdAndVoterKindAndVoterId(UUID episodeId, VoterKind voterKind, String voterId);

    long countByEpisodeId(UUID episodeId);

    long countByVariantId(UUID variantId);
}
