package com.example.channelinsight.service;

import java.time.Instant;

public interface AnalysisTier {

    TierLookup lookup(String channelId, Instant now);

    Freshness freshHitLabel();
}
