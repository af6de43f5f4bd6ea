package com.example.channelinsight.service;

import com.example.channelinsight.cache.CacheNamespace;
import com.example.channelinsight.cache.FastCache;
import com.example.channelinsight.config.AnalysisProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class CacheAnalysisTier implements AnalysisTier {

    private final FastCache cache;
    private final StalenessPolicy stalenessPolicy;
    private final Duration ttl;

    public CacheAnalysisTier(FastCache cache, StalenessPolicy stalenessPolicy, AnalysisProperties properties) {
        this.cache = cache;
        this.stalenessPolicy = stalenessPolicy;
        this.ttl = properties.cache().channelAnalysisTtl();
    }

    @Override
    public TierLookup lookup(String channelId, Instant now) {
        Optional<CachedAnalysis> cached = cache.get(CacheNamespace.CHANNEL_ANALYSIS, channelId, CachedAnalysis.class);
        if (cached.isEmpty() || cached.get().channel() == null) {
            return TierLookup.miss();
        }
        CachedAnalysis entry = cached.get();
        if (stalenessPolicy.classify(entry.analysis(), now) != Staleness.FRESH) {
            return TierLookup.miss();
        }
        return TierLookup.hit(Staleness.FRESH, entry.channel(), entry.analysis());
    }

    @Override
    public Freshness freshHitLabel() {
        return Freshness.CACHED;
    }

    public void put(ChannelRecord channel, AnalysisRecord analysis) {
        cache.put(CacheNamespace.CHANNEL_ANALYSIS, analysis.channelId(), new CachedAnalysis(channel, analysis), ttl);
    }

    record CachedAnalysis(ChannelRecord channel, AnalysisRecord analysis) {
    }
}
