package com.example.channelinsight.service;

import java.time.Instant;
import java.util.List;

public record VideoRecord(
        String videoId,
        String channelId,
        String title,
        String description,
        Instant publishedAt,
        Integer durationSec,
        Long viewCount,
        Long likeCount,
        Long commentCount,
        List<String> tags,
        String categoryId,
        boolean detailsAvailable
) {

    public VideoRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static VideoRecord listed(String videoId, String channelId, String title, String description,
                                     Instant publishedAt) {
        return new VideoRecord(videoId, channelId, title, description, publishedAt,
                null, null, null, null, List.of(), null, false);
    }

    public VideoRecord enrichWith(VideoRecord details) {
        return new VideoRecord(
                videoId,
                details.channelId() != null ? details.channelId() : channelId,
                details.title() != null ? details.title() : title,
                details.description() != null ? details.description() : description,
                details.publishedAt() != null ? details.publishedAt() : publishedAt,
                details.durationSec(),
                details.viewCount(),
                details.likeCount(),
                details.commentCount(),
                details.tags(),
                details.categoryId(),
                true);
    }
}
