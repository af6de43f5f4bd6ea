package com.example.channelinsight.service;

import java.util.List;

public record AnalysisOutcome(ChannelRecord channel, List<VideoRecord> sample, AnalysisRecord analysis) {

    public AnalysisOutcome {
        sample = List.copyOf(sample);
    }
}
