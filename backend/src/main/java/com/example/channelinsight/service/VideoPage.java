package com.example.channelinsight.service;

import java.util.List;

public record VideoPage(List<VideoRecord> videos, String nextPageToken) {

    public VideoPage {
        videos = videos == null ? List.of() : List.copyOf(videos);
    }

    public boolean hasNext() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
