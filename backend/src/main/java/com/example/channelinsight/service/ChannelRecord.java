package com.example.channelinsight.service;

import java.time.Instant;

public record ChannelRecord(
        String channelId,
        String title,
        String description,
        String customUrl,
        String country,
        String thumbnailUrl,
        Instant publishedAt,
        long subscriberCount,
        long videoCount,
        long viewCount,
        String uploadsPlaylistId,
        Instant fetchedAt
) {
}
