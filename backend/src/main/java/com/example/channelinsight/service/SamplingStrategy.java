package com.example.channelinsight.service;

public enum SamplingStrategy {
    ALL_VIDEOS,
    RECENT_DISTRIBUTED,
    LARGE_CHANNEL
}
