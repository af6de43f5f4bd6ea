package com.example.channelinsight.dto;

import java.time.Instant;

public record ChannelInfo(
        String id,
        String title,
        String description,
        String customUrl,
        String country,
        String thumbnailUrl,
        Instant publishedAt,
        long subscriberCount,
        long videoCount,
        long viewCount
) {
}
