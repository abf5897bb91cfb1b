package com.example.series_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "script_vote",
        uniqueConstraints = @UniqueConstraint(name = "uq_script_vote_voter", columnNames = {"script_id", "voter_id"}),
        indexes = @Index(name = "idx_script_vote_script", columnList = "script_id")
)
public class ScriptVote {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "script_id", nullable = false, foreignKey = @ForeignKey(name = "fk_script_vote_script"))
    private Script script;

    @Column(name = "voter_id", nullable = false, length = 128)
    private String voterId;

    // +1 or -1
    @Column(name = "vote_value", nullable = false)
    private int voteValue;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ScriptVote() {}

    public ScriptVote(Script script, String voterId, int value) {
        this.script = script;
        this.voterId = voterId;
        this.voteValue = value;
    }

    public UUID getId() { return id; }
    public Script getScript() { return script; }
    public String getVoterId() { return voterId; }

    public int getValue() { return voteValue; }
    public void setValue(int value) { this.voteValue = value; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
