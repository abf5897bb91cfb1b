package com.example.series_backend.model;

import com.example.series_backend.util.EpisodeStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "episode",
        uniqueConstraints = @UniqueConstraint(name = "uq_episode_series_number", columnNames = {"series_id", "episode_number"}),
        indexes = {
                @Index(name = "idx_episode_status", columnList = "status"),
                @Index(name = "idx_episode_clip_voting_ends", columnList = "status, clip_voting_ends_at")
        }
)
public class Episode {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "series_id", nullable = false, foreignKey = @ForeignKey(name = "fk_episode_series"))
    private Series series;

    @Column(name = "episode_number", nullable = false)
    private int episodeNumber;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private EpisodeStatus status = EpisodeStatus.PENDING;

    // EpisodeBrief snapshot taken when the series was dispatched.
    @Column(name = "brief", length = 20000)
    private String brief;

    @Column(name = "video_url", length = 2048)
    private String videoUrl;

    @Column(name = "tts_audio_url", length = 2048)
    private String ttsAudioUrl;

    @Column(name = "clip_voting_ends_at")
    private Instant clipVotingEndsAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Episode() {}

    public Episode(Series series, int episodeNumber, String title) {
        this.series = series;
        this.episodeNumber = episodeNumber;
        this.title = title;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public Series getSeries() { return series; }
    public void setSeries(Series series) { this.series = series; }

    public int getEpisodeNumber() { return episodeNumber; }
    public void setEpisodeNumber(int episodeNumber) { this.episodeNumber = episodeNumber; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public EpisodeStatus getStatus() { return status; }
    public void setStatus(EpisodeStatus status) { this.status = status; }

    public String getBrief() { return brief; }
    public void setBrief(String brief) { this.brief = brief; }

    public String getVideoUrl() { return videoUrl; }
    public void setVideoUrl(String videoUrl) { this.videoUrl = videoUrl; }

    public String getTtsAudioUrl() { return ttsAudioUrl; }
    public void setTtsAudioUrl(String ttsAudioUrl) { this.ttsAudioUrl = ttsAudioUrl; }

    public Instant getClipVotingEndsAt() { return clipVotingEndsAt; }
    public void setClipVotingEndsAt(Instant clipVotingEndsAt) { this.clipVotingEndsAt = clipVotingEndsAt; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }

    /**
     * An episode is playable once a clip is selected and its video is known.
     */
    public boolean isPlayable() {
        return status == EpisodeStatus.CLIP_SELECTED && videoUrl != null;
    }
}
