package com.example.channelinsight.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app")
public record AnalysisProperties(
        @DefaultValue YouTube youtube,
        @DefaultValue Gemini gemini,
        @DefaultValue Analysis analysis,
        @DefaultValue Cache cache
) {

    public record YouTube(
            @DefaultValue("") String apiKey,
            @DefaultValue("https://www.googleapis.com/youtube/v3") String baseUrl,
            @DefaultValue("10000") long dailyQuota,
            @DefaultValue("1d") Duration quotaWindow,
            @DefaultValue("America/Los_Angeles") String quotaZone,
            @DefaultValue("20") int maxPages,
            @DefaultValue("10s") Duration timeout,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("500ms") Duration initialBackoff
    ) {
    }

    public record Gemini(
            @DefaultValue("") String apiKey,
            @DefaultValue("https://generativelanguage.googleapis.com/v1beta") String baseUrl,
            @DefaultValue("gemini-2.5-flash") String model,
            @DefaultValue("1.0") double temperature,
            @DefaultValue("1000") int maxOutputTokens,
            @DefaultValue("30s") Duration timeout,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("1s") Duration initialBackoff,
            @DefaultValue("50") int minSummaryLength,
            @DefaultValue("2000000") long dailyTokenBudget,
            @DefaultValue("true") boolean contextCaching
    ) {
    }

    public record Analysis(
            @DefaultValue("30d") Duration stalenessWindow,
            @DefaultValue("50") int maxSample,
            @DefaultValue("true") boolean degradedMode,
            @DefaultValue("4") int maxConcurrentComputations
    ) {
    }

    public record Cache(
            @DefaultValue("7d") Duration channelAnalysisTtl,
            @DefaultValue("7d") Duration channelMetadataTtl,
            @DefaultValue("6h") Duration videoListTtl,
            @DefaultValue("24h") Duration urlMappingTtl,
            @DefaultValue("10000") long maximumSize
    ) {
    }
}
