package com.example.channelinsight.service;

import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class StalenessPolicy {

    private static final Duration FRESH_AGE = Duration.ofDays(7);
    private static final Duration RECENT_AGE = Duration.ofDays(14);

    public Staleness classify(AnalysisRecord record, Instant now) {
        if (record == null) {
            return Staleness.MISSING;
        }
        if (record.expiresAt() == null || now.isAfter(record.expiresAt())) {
            return Staleness.STALE;
        }
        return Staleness.FRESH;
    }

    public String ageLabel(AnalysisRecord record, Instant now) {
        if (classify(record, now) != Staleness.FRESH) {
            return "stale";
        }
        Duration age = record.analyzedAt() == null ? Duration.ZERO : Duration.between(record.analyzedAt(), now);
        if (age.compareTo(FRESH_AGE) < 0) {
            return "fresh";
        }
        if (age.compareTo(RECENT_AGE) < 0) {
            return "recent";
        }
        return "aging";
    }
}
