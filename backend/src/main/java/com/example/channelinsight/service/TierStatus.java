package com.example.channelinsight.service;

public enum TierStatus {
    HIT_FRESH,
    HIT_STALE,
    MISS
}
