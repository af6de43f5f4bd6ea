package com.example.channelinsight.service;

import java.util.List;

public record GeneratedAnalysis(
        String summary,
        List<String> themes,
        String targetAudience,
        String contentStyle,
        String uploadFrequency,
        double confidence,
        String modelVersion
) {

    public GeneratedAnalysis {
        themes = List.copyOf(themes);
    }
}
