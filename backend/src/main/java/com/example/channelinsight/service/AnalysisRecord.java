package com.example.channelinsight.service;

import java.time.Instant;
import java.util.List;

public record AnalysisRecord(
        String channelId,
        String summary,
        List<String> themes,
        String targetAudience,
        String contentStyle,
        String uploadFrequency,
        List<String> videoSampleIds,
        int analyzedVideosCount,
        long totalVideosCount,
        double confidence,
        String modelVersion,
        SamplingStrategy samplingStrategy,
        boolean degraded,
        Instant analyzedAt,
        Instant expiresAt
) {

    public AnalysisRecord {
        themes = themes == null ? List.of() : List.copyOf(themes);
        videoSampleIds = videoSampleIds == null ? List.of() : List.copyOf(videoSampleIds);
    }
}
