package com.example.channelinsight.dto;

import com.example.channelinsight.service.Freshness;
import com.example.channelinsight.service.SamplingStrategy;
import java.time.Instant;

public record AnalysisMeta(
        Instant analyzedAt,
        Instant expiresAt,
        int videosAnalyzed,
        long totalVideos,
        Freshness freshness,
        String ageLabel,
        double confidence,
        String modelVersion,
        SamplingStrategy samplingStrategy,
        boolean degraded
) {
}
