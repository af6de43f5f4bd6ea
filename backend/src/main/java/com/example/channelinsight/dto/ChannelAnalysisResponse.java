package com.example.channelinsight.dto;

public record ChannelAnalysisResponse(
        ChannelInfo channel,
        AnalysisBody analysis,
        AnalysisMeta meta
) {
}
