package com.example.channelinsight.service;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Freshness {
    CACHED,
    STORED,
    STALE,
    NEW;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
