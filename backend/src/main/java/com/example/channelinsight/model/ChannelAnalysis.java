package com.example.channelinsight.model;

import com.example.channelinsight.service.SamplingStrategy;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "channel_analyses")
public class ChannelAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "channel_id", nullable = false, unique = true)
    private String channelId;

    @Column(nullable = false, length = 10000)
    private String summary;

    @ElementCollection
    @CollectionTable(name = "channel_analysis_themes", joinColumns = @JoinColumn(name = "analysis_id"))
    @OrderColumn(name = "position")
    @Column(name = "theme", nullable = false, length = 500)
    private List<String> themes = new ArrayList<>();

    @Column(name = "target_audience", length = 2000)
    private String targetAudience;

    @Column(name = "content_style", length = 2000)
    private String contentStyle;

    @Column(name = "upload_frequency", length = 500)
    private String uploadFrequency;

    @ElementCollection
    @CollectionTable(name = "channel_analysis_samples", joinColumns = @JoinColumn(name = "analysis_id"))
    @OrderColumn(name = "position")
    @Column(name = "video_id", nullable = false)
    private List<String> videoSampleIds = new ArrayList<>();

    @Column(name = "analyzed_videos_count", nullable = false)
    private int analyzedVideosCount;

    @Column(name = "total_videos_count", nullable = false)
    private long totalVideosCount;

    @Column(nullable = false)
    private double confidence;

    @Column(name = "model_version")
    private String modelVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "sampling_strategy")
    private SamplingStrategy samplingStrategy;

    @Column(nullable = false)
    private boolean degraded;

    @Column(name = "analyzed_at", nullable = false)
    private Instant analyzedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public ChannelAnalysis() {
    }

    public ChannelAnalysis(String channelId) {
        this.channelId = channelId;
    }

    public Long getId() {
        return id;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public List<String> getThemes() {
        return themes;
    }

    public void setThemes(List<String> themes) {
        this.themes.clear();
        if (themes != null) {
            this.themes.addAll(themes);
        }
    }

    public String getTargetAudience() {
        return targetAudience;
    }

    public void setTargetAudience(String targetAudience) {
        this.targetAudience = targetAudience;
    }

    public String getContentStyle() {
        return contentStyle;
    }

    public void setContentStyle(String contentStyle) {
        this.contentStyle = contentStyle;
    }

    public String getUploadFrequency() {
        return uploadFrequency;
    }

    public void setUploadFrequency(String uploadFrequency) {
        this.uploadFrequency = uploadFrequency;
    }

    public List<String> getVideoSampleIds() {
        return videoSampleIds;
    }

    public void setVideoSampleIds(List<String> videoSampleIds) {
        this.videoSampleIds.clear();
        if (videoSampleIds != null) {
            this.videoSampleIds.addAll(videoSampleIds);
        }
    }

    public int getAnalyzedVideosCount() {
        return analyzedVideosCount;
    }

    public void setAnalyzedVideosCount(int analyzedVideosCount) {
        this.analyzedVideosCount = analyzedVideosCount;
    }

    public long getTotalVideosCount() {
        return totalVideosCount;
    }

    public void setTotalVideosCount(long totalVideosCount) {
        this.totalVideosCount = totalVideosCount;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    public SamplingStrategy getSamplingStrategy() {
        return samplingStrategy;
    }

    public void setSamplingStrategy(SamplingStrategy samplingStrategy) {
        this.samplingStrategy = samplingStrategy;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public void setAnalyzedAt(Instant analyzedAt) {
        this.analyzedAt = analyzedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
