package com.example.channelinsight.service;

import com.example.channelinsight.dto.AnalysisBody;
import com.example.channelinsight.dto.AnalysisHistoryResponse;
import com.example.channelinsight.dto.AnalysisMeta;
import com.example.channelinsight.dto.ChannelAnalysisResponse;
import com.example.channelinsight.dto.ChannelInfo;
import com.example.channelinsight.exception.AnalysisNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    private final ChannelIdentifierParser identifierParser;
    private final MetadataFetcher metadataFetcher;
    private final CacheAnalysisTier cacheTier;
    private final AnalysisStore store;
    private final List<AnalysisTier> tiers;
    private final SingleFlightCoordinator coordinator;
    private final StalenessPolicy stalenessPolicy;
    private final Clock clock;

    public ResolutionEngine(ChannelIdentifierParser identifierParser,
                            MetadataFetcher metadataFetcher,
                            CacheAnalysisTier cacheTier,
                            StoreAnalysisTier storeTier,
                            AnalysisStore store,
                            SingleFlightCoordinator coordinator,
                            StalenessPolicy stalenessPolicy,
                            Clock clock) {
        this.identifierParser = identifierParser;
        this.metadataFetcher = metadataFetcher;
        this.cacheTier = cacheTier;
        this.store = store;
        this.tiers = List.of(cacheTier, storeTier);
        this.coordinator = coordinator;
        this.stalenessPolicy = stalenessPolicy;
        this.clock = clock;
    }

    public ChannelAnalysisResponse resolve(String channelUrlOrId) {
        ChannelReference reference = identifierParser.parse(channelUrlOrId);
        String channelId = knownChannelId(reference)
                .orElseGet(() -> metadataFetcher.resolveChannelId(reference));

        Instant now = clock.instant();
        TierLookup stale = null;
        for (AnalysisTier tier : tiers) {
            TierLookup lookup = tier.lookup(channelId, now);
            if (lookup.status() == TierStatus.HIT_FRESH) {
                if (tier != cacheTier) {
                    cacheTier.put(lookup.channel(), lookup.analysis());
                }
                log.debug("Serving {} analysis of {}", tier.freshHitLabel().label(), channelId);
                return toResponse(lookup.channel(), lookup.analysis(), tier.freshHitLabel(), now);
            }
            if (lookup.status() == TierStatus.HIT_STALE && isNewer(lookup, stale)) {
                stale = lookup;
            }
        }

        if (stale != null) {
            refreshInBackground(channelId);
            return toResponse(stale.channel(), stale.analysis(), Freshness.STALE, now);
        }

        AnalysisOutcome outcome = await(coordinator.submitOrRunInline(channelId, this::persist));
        return toResponse(outcome.channel(), outcome.analysis(), Freshness.NEW, clock.instant());
    }

    public ChannelAnalysisResponse getExisting(String reference) {
        ChannelReference parsed = identifierParser.parse(reference);
        String channelId = knownChannelId(parsed)
                .orElseThrow(() -> new AnalysisNotFoundException(reference));

        Instant now = clock.instant();
        for (AnalysisTier tier : tiers) {
            TierLookup lookup = tier.lookup(channelId, now);
            if (lookup.isHit()) {
                Freshness freshness = lookup.status() == TierStatus.HIT_FRESH ? tier.freshHitLabel() : Freshness.STALE;
                return toResponse(lookup.channel(), lookup.analysis(), freshness, now);
            }
        }
        throw new AnalysisNotFoundException(reference);
    }

    public List<AnalysisHistoryResponse> history(String channelId) {
        return store.history(channelId);
    }

    private Optional<String> knownChannelId(ChannelReference reference) {
        Optional<String> cached = metadataFetcher.cachedChannelId(reference);
        if (cached.isPresent() || reference.kind() == ChannelReference.Kind.USERNAME) {
            return cached;
        }
        return store.findChannelIdByCustomUrl(reference.value());
    }

    private void refreshInBackground(String channelId) {
        log.info("Analysis of {} is stale; refreshing in the background", channelId);
        coordinator.submit(channelId, this::persist)
                .exceptionally(ex -> {
                    log.error("Background refresh of {} failed: {}", channelId, unwrap(ex).getMessage());
                    return null;
                });
    }

    private void persist(AnalysisOutcome outcome) {
        try {
            store.save(outcome);
        } catch (RuntimeException ex) {
            log.error("Failed to store analysis of {}: {}", outcome.analysis().channelId(), ex.getMessage(), ex);
        }
        cacheTier.put(outcome.channel(), outcome.analysis());
    }

    private static boolean isNewer(TierLookup candidate, TierLookup current) {
        if (current == null) {
            return true;
        }
        Instant candidateAt = candidate.analysis().analyzedAt();
        Instant currentAt = current.analysis().analyzedAt();
        return candidateAt != null && (currentAt == null || candidateAt.isAfter(currentAt));
    }

    private static AnalysisOutcome await(CompletableFuture<AnalysisOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            Throwable cause = unwrap(ex);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private ChannelAnalysisResponse toResponse(ChannelRecord channel, AnalysisRecord analysis,
                                               Freshness freshness, Instant now) {
        ChannelInfo channelInfo = new ChannelInfo(
                channel.channelId(),
                channel.title(),
                channel.description(),
                channel.customUrl(),
                channel.country(),
                channel.thumbnailUrl(),
                channel.publishedAt(),
                channel.subscriberCount(),
                channel.videoCount(),
                channel.viewCount());
        AnalysisBody body = new AnalysisBody(
                analysis.summary(),
                analysis.themes(),
                analysis.targetAudience(),
                analysis.contentStyle(),
                analysis.uploadFrequency());
        AnalysisMeta meta = new AnalysisMeta(
                analysis.analyzedAt(),
                analysis.expiresAt(),
                analysis.analyzedVideosCount(),
                analysis.totalVideosCount(),
                freshness,
                stalenessPolicy.ageLabel(analysis, now),
                analysis.confidence(),
                analysis.modelVersion(),
                analysis.samplingStrategy(),
                analysis.degraded());
        return new ChannelAnalysisResponse(channelInfo, body, meta);
    }
}
