package com.example.channelinsight.service;

import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class StoreAnalysisTier implements AnalysisTier {

    private final AnalysisStore store;
    private final StalenessPolicy stalenessPolicy;

    public StoreAnalysisTier(AnalysisStore store, StalenessPolicy stalenessPolicy) {
        this.store = store;
        this.stalenessPolicy = stalenessPolicy;
    }

    @Override
    public TierLookup lookup(String channelId, Instant now) {
        Optional<AnalysisRecord> analysis = store.findAnalysis(channelId);
        if (analysis.isEmpty()) {
            return TierLookup.miss();
        }
        Optional<ChannelRecord> channel = store.findChannel(channelId);
        if (channel.isEmpty()) {
            return TierLookup.miss();
        }
        return TierLookup.hit(stalenessPolicy.classify(analysis.get(), now), channel.get(), analysis.get());
    }

    @Override
    public Freshness freshHitLabel() {
        return Freshness.STORED;
    }
}
