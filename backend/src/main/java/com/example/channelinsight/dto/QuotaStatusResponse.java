package com.example.channelinsight.dto;

import java.time.Duration;

public record QuotaStatusResponse(
        LedgerStatus metadata,
        LedgerStatus generative,
        int inFlightComputations
) {

    public record LedgerStatus(String name, long budget, long consumed, long remaining, long resetsInSeconds) {

        public static LedgerStatus of(String name, long budget, long consumed, long remaining, Duration untilReset) {
            return new LedgerStatus(name, budget, consumed, remaining, untilReset.toSeconds());
        }
    }
}
