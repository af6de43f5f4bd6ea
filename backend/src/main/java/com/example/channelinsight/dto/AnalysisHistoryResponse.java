package com.example.channelinsight.dto;

import java.time.Instant;

public record AnalysisHistoryResponse(
        Instant analyzedAt,
        Instant expiresAt,
        String modelVersion,
        double confidence,
        boolean degraded,
        Instant archivedAt
) {
}
