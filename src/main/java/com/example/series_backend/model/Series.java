package com.example.series_backend.model;

import com.example.series_backend.util.SeriesStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "series",
        uniqueConstraints = @UniqueConstraint(name = "uq_series_script", columnNames = "script_id"),
        indexes = @Index(name = "idx_series_status", columnList = "status")
)
public class Series {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "script_id", nullable = false)
    private UUID scriptId;

    @Column(name = "studio_id")
    private UUID studioId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "logline", length = 1000)
    private String logline;

    @Column(name = "genre", length = 64)
    private String genre;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private SeriesStatus status = SeriesStatus.PENDING;

    @Column(name = "episode_count", nullable = false)
    private int episodeCount;

    @Column(name = "series_bible", length = 8000)
    private String seriesBible;

    @Column(name = "poster_spec", length = 4000)
    private String posterSpec;

    @Column(name = "completed_at")
    private Instant completedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Series() {}

    public Series(UUID scriptId, String title) {
        this.scriptId = scriptId;
        this.title = title;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getScriptId() { return scriptId; }
    public void setScriptId(UUID scriptId) { this.scriptId = scriptId; }

    public UUID getStudioId() { return studioId; }
    public void setStudioId(UUID studioId) { this.studioId = studioId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getLogline() { return logline; }
    public void setLogline(String logline) { this.logline = logline; }

    public String getGenre() { return genre; }
    public void setGenre(String genre) { this.genre = genre; }

    public SeriesStatus getStatus() { return status; }
    public void setStatus(SeriesStatus status) { this.status = status; }

    public int getEpisodeCount() { return episodeCount; }
    public void setEpisodeCount(int episodeCount) { this.episodeCount = episodeCount; }

    public String getSeriesBible() { return seriesBible; }
    public void setSeriesBible(String seriesBible) { this.seriesBible = seriesBible; }

    public String getPosterSpec() { return posterSpec; }
    public void setPosterSpec(String posterSpec) { this.posterSpec = posterSpec; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }
}
