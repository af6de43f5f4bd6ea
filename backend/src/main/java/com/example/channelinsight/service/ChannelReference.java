package com.example.channelinsight.service;

import java.util.Locale;

public record ChannelReference(Kind kind, String value, String original) {

    public enum Kind {
        CHANNEL_ID,
        HANDLE,
        USERNAME,
        CUSTOM_NAME
    }

    public boolean isChannelId() {
        return kind == Kind.CHANNEL_ID;
    }

    public String cacheKey() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + value.toLowerCase(Locale.ROOT);
    }
}
