package com.example.channelinsight.cache;

public enum CacheNamespace {
    CHANNEL_META("channel_meta"),
    CHANNEL_ANALYSIS("channel_analysis"),
    VIDEO_LIST("video_list"),
    CHANNEL_URL("channel_url");

    private final String prefix;

    CacheNamespace(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String key(String identifier) {
        return prefix + ":" + identifier;
    }
}
