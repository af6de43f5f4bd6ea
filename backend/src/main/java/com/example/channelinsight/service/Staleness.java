package com.example.channelinsight.service;

public enum Staleness {
    FRESH,
    STALE,
    MISSING
}
