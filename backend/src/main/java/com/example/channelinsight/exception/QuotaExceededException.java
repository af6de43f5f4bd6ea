package com.example.channelinsight.exception;

import java.time.Duration;

public class QuotaExceededException extends AnalysisException {

    private final String ledger;
    private final long requested;
    private final long remaining;
    private final Duration retryAfter;

    public QuotaExceededException(String ledger, long requested, long remaining, Duration retryAfter) {
        super(ErrorCode.QUOTA_EXCEEDED, String.format(
                "%s budget exhausted: requested %d, remaining %d, resets in %ds",
                ledger, requested, remaining, retryAfter.toSeconds()));
        this.ledger = ledger;
        this.requested = requested;
        this.remaining = remaining;
        this.retryAfter = retryAfter;
    }

    public String getLedger() {
        return ledger;
    }

    public long getRequested() {
        return requested;
    }

    public long getRemaining() {
        return remaining;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
