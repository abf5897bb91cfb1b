package com.example.series_backend.model;

import com.example.series_backend.util.ScriptStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * A proposal competing in a voting period. Tallies are only ever changed through the atomic
 * counter queries in {@link com.example.series_backend.repository.ScriptRepository}; dynamic
 * updates keep an entity flush from writing stale counts back.
 */
@Entity
@DynamicUpdate
@Table(
        name = "script",
        indexes = {
                @Index(name = "idx_script_status_period", columnList = "status, voting_period_id"),
                @Index(name = "idx_script_studio", columnList = "studio_id")
        }
)
public class Script {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "studio_id", nullable = false)
    private UUID studioId;

    @Column(name = "owner_agent_id", nullable = false, length = 128)
    private String ownerAgentId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "logline", length = 1000)
    private String logline;

    @Column(name = "genre", length = 64)
    private String genre;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ScriptStatus status = ScriptStatus.DRAFT;

    @Column(name = "vote_count", nullable = false)
    private int voteCount;

    @Column(name = "upvotes", nullable = false)
    private int upvotes;

    @Column(name = "downvotes", nullable = false)
    private int downvotes;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "voting_period_id", foreignKey = @ForeignKey(name = "fk_script_voting_period"))
    private VotingPeriod votingPeriod;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "voting_ends_at")
    private Instant votingEndsAt;

    @Column(name = "series_id")
    private UUID seriesId;

    @Column(name = "produced_at")
    private Instant producedAt;

    // Structured production data, serialized by ScriptDataCodec.
    @Column(name = "script_data", length = 20000)
    private String scriptData;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Script() {}

    public Script(UUID studioId, String ownerAgentId, String title) {
        this.studioId = studioId;
        this.ownerAgentId = ownerAgentId;
        this.title = title;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getStudioId() { return studioId; }
    public void setStudioId(UUID studioId) { this.studioId = studioId; }

    public String getOwnerAgentId() { return ownerAgentId; }
    public void setOwnerAgentId(String ownerAgentId) { this.ownerAgentId = ownerAgentId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getLogline() { return logline; }
    public void setLogline(String logline) { this.logline = logline; }

    public String getGenre() { return genre; }
    public void setGenre(String genre) { this.genre = genre; }

    public ScriptStatus getStatus() { return status; }
    public void setStatus(ScriptStatus status) { this.status = status; }

    public int getVoteCount() { return voteCount; }
    public void setVoteCount(int voteCount) { this.voteCount = voteCount; }

    public int getUpvotes() { return upvotes; }
    public void setUpvotes(int upvotes) { this.upvotes = upvotes; }

    public int getDownvotes() { return downvotes; }
    public void setDownvotes(int downvotes) { this.downvotes = downvotes; }

    public VotingPeriod getVotingPeriod() { return votingPeriod; }
    public void setVotingPeriod(VotingPeriod votingPeriod) { this.votingPeriod = votingPeriod; }

    public Instant getSubmittedAt() { return submittedAt; }
    public void setSubmittedAt(Instant submittedAt) { this.submittedAt = submittedAt; }

    public Instant getVotingEndsAt() { return votingEndsAt; }
    public void setVotingEndsAt(Instant votingEndsAt) { this.votingEndsAt = votingEndsAt; }

    public UUID getSeriesId() { return seriesId; }
    public void setSeriesId(UUID seriesId) { this.seriesId = seriesId; }

    public Instant getProducedAt() { return producedAt; }
    public void setProducedAt(Instant producedAt) { this.producedAt = producedAt; }

    public String getScriptData() { return scriptData; }
    public void setScriptData(String scriptData) { this.scriptData = scriptData; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
