package com.example.series_backend.repository;

import com.example.series_backend.model.ScriptVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface ScriptVoteRepository extends JpaRepository<ScriptVote, UUID> {

    Optional<ScriptVote> findByScriptIdAndVoterId(UUID scriptId, String voterId);

    long countByScriptId(UUID scriptId);

    @Query("select coalesce(sum(v.voteValue), 0) from ScriptVote v where v.script.id = :scriptId")
    long sumValuesByScriptId(@Param("scriptId") UUID scriptId);
}
