package com.example.channelinsight.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "channel_analysis_history", indexes = @Index(name = "idx_analysis_history_channel", columnList = "channel_id"))
public class ChannelAnalysisHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "channel_id", nullable = false)
    private String channelId;

    @Column(name = "analyzed_at", nullable = false)
    private Instant analyzedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "model_version")
    private String modelVersion;

    @Column(nullable = false)
    private double confidence;

    @Column(nullable = false)
    private boolean degraded;

    @Column(name = "archived_at", nullable = false)
    private Instant archivedAt;

    public ChannelAnalysisHistory() {
    }

    public ChannelAnalysisHistory(ChannelAnalysis previous, Instant archivedAt) {
        this.channelId = previous.getChannelId();
        this.analyzedAt = previous.getAnalyzedAt();
        this.expiresAt = previous.getExpiresAt();
        this.modelVersion = previous.getModelVersion();
        this.confidence = previous.getConfidence();
        this.degraded = previous.isDegraded();
        this.archivedAt = archivedAt;
    }

    public Long getId() {
        return id;
    }

    public String getChannelId() {
        return channelId;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public Instant getArchivedAt() {
        return archivedAt;
    }
}
