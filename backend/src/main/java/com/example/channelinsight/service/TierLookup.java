package com.example.channelinsight.service;

public record TierLookup(TierStatus status, ChannelRecord channel, AnalysisRecord analysis) {

    private static final TierLookup MISS = new TierLookup(TierStatus.MISS, null, null);

    public static TierLookup miss() {
        return MISS;
    }

    public static TierLookup hit(Staleness staleness, ChannelRecord channel, AnalysisRecord analysis) {
        return new TierLookup(staleness == Staleness.FRESH ? TierStatus.HIT_FRESH : TierStatus.HIT_STALE,
                channel, analysis);
    }

    public boolean isHit() {
        return status != TierStatus.MISS;
    }
}
