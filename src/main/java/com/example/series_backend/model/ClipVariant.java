package com.example.series_backend.model;

import com.example.series_backend.util.VariantStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@DynamicUpdate
@Table(
        name = "clip_variant",
        uniqueConstraints = @UniqueConstraint(name = "uq_clip_variant_episode_number", columnNames = {"episode_id", "variant_number"}),
        indexes = @Index(name = "idx_clip_variant_episode", columnList = "episode_id")
)
public class ClipVariant {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "episode_id", nullable = false, foreignKey = @ForeignKey(name = "fk_clip_variant_episode"))
    private Episode episode;

    @Column(name = "variant_number", nullable = false)
    private int variantNumber;

    @Column(name = "video_url", length = 2048)
    private String videoUrl;

    @Column(name = "vote_count", nullable = false)
    private int voteCount;

    @Column(name = "is_selected", nullable = false)
    private boolean selected;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private VariantStatus status = VariantStatus.COMPLETED;

    @Column(name = "prompt", length = 8000)
    private String prompt;

    @Column(name = "audio_text", length = 4000)
    private String audioText;

    @Column(name = "model_used", length = 128)
    private String modelUsed;

    @Column(name = "seed")
    private Long seed;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    @Column(name = "generation_time_ms")
    private Long generationTimeMs;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ClipVariant() {}

    public ClipVariant(Episode episode, int variantNumber) {
        this.episode = episode;
        this.variantNumber = variantNumber;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public Episode getEpisode() { return episode; }
    public int getVariantNumber() { return variantNumber; }

    public String getVideoUrl() { return videoUrl; }
    public void setVideoUrl(String videoUrl) { this.videoUrl = videoUrl; }

    public int getVoteCount() { return voteCount; }
    public void setVoteCount(int voteCount) { this.voteCount = voteCount; }

    public boolean isSelected() { return selected; }
    public void setSelected(boolean selected) { this.selected = selected; }

    public VariantStatus getStatus() { return status; }
    public void setStatus(VariantStatus status) { this.status = status; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public String getAudioText() { return audioText; }
    public void setAudioText(String audioText) { this.audioText = audioText; }

    public String getModelUsed() { return modelUsed; }
    public void setModelUsed(String modelUsed) { this.modelUsed = modelUsed; }

    public Long getSeed() { return seed; }
    public void setSeed(Long seed) { this.seed = seed; }

    public Double getDurationSeconds() { return durationSeconds; }
    public void setDurationSeconds(Double durationSeconds) { this.durationSeconds = durationSeconds; }

    public Long getGenerationTimeMs() { return generationTimeMs; }
    public void setGenerationTimeMs(Long generationTimeMs) { this.generationTimeMs = generationTimeMs; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
