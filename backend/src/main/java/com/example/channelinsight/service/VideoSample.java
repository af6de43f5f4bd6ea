package com.example.channelinsight.service;

import java.util.List;

public record VideoSample(List<VideoRecord> videos, SamplingStrategy strategy) {

    public VideoSample {
        videos = List.copyOf(videos);
    }

    public List<String> videoIds() {
        return videos.stream().map(VideoRecord::videoId).toList();
    }
}
