package com.example.channelinsight.service;

import com.example.channelinsight.config.AnalysisProperties;
import com.example.channelinsight.exception.AnalysisValidationException;
import com.example.channelinsight.exception.ProviderException;
import com.example.channelinsight.exception.QuotaExceededException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * At most one analysis computation per channel. The completion hook runs on the computing thread
 * before waiters are released.
 */
@Service
public class SingleFlightCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SingleFlightCoordinator.class);

    private final MetadataFetcher metadataFetcher;
    private final VideoSampler videoSampler;
    private final PromptAssembler promptAssembler;
    private final AnalysisGenerator analysisGenerator;
    private final DegradedAnalysisBuilder degradedAnalysisBuilder;
    private final AnalysisProperties.Analysis analysis;
    private final Clock clock;
    private final Executor executor;
    private final ConcurrentMap<String, CompletableFuture<AnalysisOutcome>> inFlight = new ConcurrentHashMap<>();

    public SingleFlightCoordinator(MetadataFetcher metadataFetcher,
                                   VideoSampler videoSampler,
                                   PromptAssembler promptAssembler,
                                   AnalysisGenerator analysisGenerator,
                                   DegradedAnalysisBuilder degradedAnalysisBuilder,
                                   AnalysisProperties properties,
                                   Clock clock,
                                   @Qualifier("analysisExecutor") Executor executor) {
        this.metadataFetcher = metadataFetcher;
        this.videoSampler = videoSampler;
        this.promptAssembler = promptAssembler;
        this.analysisGenerator = analysisGenerator;
        this.degradedAnalysisBuilder = degradedAnalysisBuilder;
        this.analysis = properties.analysis();
        this.clock = clock;
        this.executor = executor;
    }

    public CompletableFuture<AnalysisOutcome> submit(String channelId, Consumer<AnalysisOutcome> completionHook) {
        return submit(channelId, completionHook, false);
    }

    // For callers that block on the result anyway: a saturated executor means computing here.
    public CompletableFuture<AnalysisOutcome> submitOrRunInline(String channelId,
                                                                Consumer<AnalysisOutcome> completionHook) {
        return submit(channelId, completionHook, true);
    }

    private CompletableFuture<AnalysisOutcome> submit(String channelId, Consumer<AnalysisOutcome> completionHook,
                                                      boolean runInlineWhenRejected) {
        CompletableFuture<AnalysisOutcome> promise = new CompletableFuture<>();
        CompletableFuture<AnalysisOutcome> existing = inFlight.putIfAbsent(channelId, promise);
        if (existing != null) {
            log.debug("Joining in-flight analysis of {}", channelId);
            return existing;
        }
        try {
            executor.execute(() -> run(channelId, completionHook, promise));
        } catch (RejectedExecutionException ex) {
            if (runInlineWhenRejected) {
                log.warn("Analysis executor is saturated; computing {} on the calling thread", channelId);
                run(channelId, completionHook, promise);
            } else {
                log.warn("Analysis executor rejected {}: {}", channelId, ex.getMessage());
                inFlight.remove(channelId, promise);
                promise.completeExceptionally(ex);
            }
        }
        return promise;
    }

    public boolean isInFlight(String channelId) {
        return inFlight.containsKey(channelId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private void run(String channelId, Consumer<AnalysisOutcome> completionHook,
                     CompletableFuture<AnalysisOutcome> promise) {
        AnalysisOutcome outcome;
        try {
            outcome = compute(channelId);
        } catch (RuntimeException ex) {
            log.warn("Analysis of {} failed: {}", channelId, ex.getMessage());
            inFlight.remove(channelId, promise);
            promise.completeExceptionally(ex);
            return;
        }
        try {
            completionHook.accept(outcome);
        } catch (RuntimeException ex) {
            log.error("Completion hook failed for {}: {}", channelId, ex.getMessage(), ex);
        }
        // The hook has persisted the outcome, so later callers find it without a new flight.
        inFlight.remove(channelId, promise);
        promise.complete(outcome);
    }

    AnalysisOutcome compute(String channelId) {
        Instant started = clock.instant();
        log.info("Computing analysis for {}", channelId);

        ChannelRecord channel = metadataFetcher.fetchChannel(channelId);
        List<VideoRecord> videos = metadataFetcher.fetchAllVideos(channel.uploadsPlaylistId());
        VideoSample sample = videoSampler.sample(videos, analysis.maxSample());
        List<VideoRecord> enriched = metadataFetcher.fetchVideoDetails(sample.videos());

        GeneratedAnalysis generated;
        boolean degraded = false;
        try {
            generated = analysisGenerator.generate(promptAssembler.build(channel, enriched));
        } catch (ProviderException | AnalysisValidationException | QuotaExceededException ex) {
            if (!analysis.degradedMode()) {
                throw ex;
            }
            log.warn("Generation unavailable for {} ({}); falling back to metadata-only analysis",
                    channelId, ex.getMessage());
            generated = degradedAnalysisBuilder.build(channel, enriched);
            degraded = true;
        }

        Instant analyzedAt = clock.instant();
        AnalysisRecord record = new AnalysisRecord(
                channelId,
                generated.summary(),
                generated.themes(),
                generated.targetAudience(),
                generated.contentStyle(),
                generated.uploadFrequency(),
                sample.videoIds(),
                enriched.size(),
                Math.max(channel.videoCount(), videos.size()),
                generated.confidence(),
                generated.modelVersion(),
                sample.strategy(),
                degraded,
                analyzedAt,
                analyzedAt.plus(analysis.stalenessWindow()));

        log.info("Analysis of {} finished in {} ms ({} of {} videos, strategy={}, degraded={})",
                channelId, Duration.between(started, analyzedAt).toMillis(), enriched.size(),
                record.totalVideosCount(), sample.strategy(), degraded);
        return new AnalysisOutcome(channel, enriched, record);
    }
}
