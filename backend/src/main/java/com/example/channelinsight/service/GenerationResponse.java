package com.example.channelinsight.service;

public record GenerationResponse(
        String text,
        String modelVersion,
        long promptTokens,
        long outputTokens,
        long cachedTokens
) {

    public long totalTokens() {
        return promptTokens + outputTokens;
    }
}
