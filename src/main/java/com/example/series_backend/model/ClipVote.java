package com.example.series_backend.model;

import com.example.series_backend.util.VoterKind;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * A voter's single active pick among the variants of one episode. The episode id is copied
 * onto the row so the one-vote-per-episode rule can live in a unique constraint.
 */
@Entity
@Table(
        name = "clip_vote",
        uniqueConstraints = @UniqueConstraint(name = "uq_clip_vote_episode_voter", columnNames = {"episode_id", "voter_kind", "voter_id"}),
        indexes = @Index(name = "idx_clip_vote_variant", columnList = "clip_variant_id")
)
public class ClipVote {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "clip_variant_id", nullable = false, foreignKey = @ForeignKey(name = "fk_clip_vote_variant"))
    private ClipVariant variant;

    @Column(name = "episode_id", nullable = false)
    private UUID episodeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "voter_kind", nullable = false, length = 16)
    private VoterKind voterKind;

    @Column(name = "voter_id", nullable = false, length = 128)
    private String voterId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ClipVote() {}

    public ClipVote(ClipVariant variant, UUID episodeId, VoterKind voterKind, String voterId) {
        this.variant = variant;
        this.episodeId = episodeId;
        this.voterKind = voterKind;
        this.voterId = voterId;
    }

    public UUID getId() { return id; }
    public ClipVariant getVariant() { return variant; }
    public UUID getEpisodeId() { return episodeId; }
    public VoterKind getVoterKind() { return voterKind; }
    public String getVoterId() { return voterId; }
    public Instant getCreatedAt() { return createdAt; }
}
