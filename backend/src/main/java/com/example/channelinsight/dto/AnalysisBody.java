package com.example.channelinsight.dto;

import java.util.List;

public record AnalysisBody(
        String summary,
        List<String> themes,
        String targetAudience,
        String contentStyle,
        String uploadFrequency
) {
}
