package com.example.channelinsight.service;

import com.example.channelinsight.cache.CacheNamespace;
import com.example.channelinsight.cache.FastCache;
import com.example.channelinsight.config.AnalysisProperties;
import com.example.channelinsight.exception.ChannelNotFoundException;
import com.example.channelinsight.exception.ProviderException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

@Service
public class MetadataFetcher {

    static final long CHANNELS_LIST_COST = 1;
    static final long PLAYLIST_ITEMS_COST = 1;
    static final long VIDEOS_LIST_COST = 1;
    static final long SEARCH_COST = 100;
    static final int DETAIL_BATCH_SIZE = 50;

    private static final Logger log = LoggerFactory.getLogger(MetadataFetcher.class);

    private final MetadataProvider provider;
    private final QuotaLedger ledger;
    private final FastCache cache;
    private final AnalysisProperties.YouTube youtube;
    private final AnalysisProperties.Cache cacheProperties;
    private final RetryTemplate retryTemplate;
    private final RetryTemplate batchRetryTemplate;

    public MetadataFetcher(MetadataProvider provider,
                           @Qualifier("metadataQuotaLedger") QuotaLedger ledger,
                           FastCache cache,
                           AnalysisProperties properties) {
        this.provider = provider;
        this.ledger = ledger;
        this.cache = cache;
        this.youtube = properties.youtube();
        this.cacheProperties = properties.cache();
        long initial = Math.max(1, youtube.initialBackoff().toMillis());
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(Math.max(1, youtube.maxAttempts()))
                .exponentialBackoff(initial, 2.0, initial * 8)
                .retryOn(ProviderException.class)
                .build();
        this.batchRetryTemplate = RetryTemplate.builder()
                .maxAttempts(2)
                .exponentialBackoff(initial, 2.0, initial * 8)
                .retryOn(ProviderException.class)
                .build();
    }

    public ChannelRecord fetchChannel(String channelId) {
        Optional<ChannelRecord> cached = cache.get(CacheNamespace.CHANNEL_META, channelId, ChannelRecord.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        ChannelRecord channel = call(retryTemplate, CHANNELS_LIST_COST, "channels.list",
                () -> provider.fetchChannel(channelId))
                .orElseThrow(() -> new ChannelNotFoundException(channelId));
        cache.put(CacheNamespace.CHANNEL_META, channelId, channel, cacheProperties.channelMetadataTtl());
        return channel;
    }

    public List<VideoRecord> fetchAllVideos(String uploadsPlaylistId) {
        if (uploadsPlaylistId == null) {
            return List.of();
        }
        Optional<VideoList> cached = cache.get(CacheNamespace.VIDEO_LIST, uploadsPlaylistId, VideoList.class);
        if (cached.isPresent()) {
            return cached.get().videos();
        }

        Map<String, VideoRecord> unique = new LinkedHashMap<>();
        String pageToken = null;
        int pages = 0;
        do {
            String token = pageToken;
            VideoPage page = call(retryTemplate, PLAYLIST_ITEMS_COST, "playlistItems.list",
                    () -> provider.fetchUploadsPage(uploadsPlaylistId, token));
            pages++;
            for (VideoRecord video : page.videos()) {
                unique.putIfAbsent(video.videoId(), video);
            }
            pageToken = page.hasNext() ? page.nextPageToken() : null;
        } while (pageToken != null && pages < youtube.maxPages());

        if (pageToken != null) {
            log.info("Stopped listing {} after {} pages ({} videos)", uploadsPlaylistId, pages, unique.size());
        }
        List<VideoRecord> videos = List.copyOf(unique.values());
        cache.put(CacheNamespace.VIDEO_LIST, uploadsPlaylistId, new VideoList(videos), cacheProperties.videoListTtl());
        return videos;
    }

    public List<VideoRecord> fetchVideoDetails(List<VideoRecord> videos) {
        List<VideoRecord> result = new ArrayList<>(videos.size());
        for (int start = 0; start < videos.size(); start += DETAIL_BATCH_SIZE) {
            List<VideoRecord> batch = videos.subList(start, Math.min(videos.size(), start + DETAIL_BATCH_SIZE));
            List<String> ids = batch.stream().map(VideoRecord::videoId).toList();
            List<VideoRecord> details;
            try {
                details = call(batchRetryTemplate, VIDEOS_LIST_COST, "videos.list",
                        () -> provider.fetchVideoDetails(ids));
            } catch (ProviderException ex) {
                log.warn("Video details unavailable for {} videos starting at {}: {}",
                        batch.size(), ids.get(0), ex.getMessage());
                result.addAll(batch);
                continue;
            }
            Map<String, VideoRecord> byId = new LinkedHashMap<>();
            for (VideoRecord detail : details) {
                byId.put(detail.videoId(), detail);
            }
            for (VideoRecord video : batch) {
                VideoRecord detail = byId.get(video.videoId());
                result.add(detail != null ? video.enrichWith(detail) : video);
            }
        }
        return result;
    }

    public String resolveChannelId(ChannelReference reference) {
        if (reference.isChannelId()) {
            return reference.value();
        }
        Optional<String> cached = cache.get(CacheNamespace.CHANNEL_URL, reference.cacheKey(), String.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        Optional<String> resolved = switch (reference.kind()) {
            case HANDLE -> call(retryTemplate, CHANNELS_LIST_COST, "channels.list",
                    () -> provider.findChannelIdByHandle(reference.value()));
            case USERNAME -> call(retryTemplate, CHANNELS_LIST_COST, "channels.list",
                    () -> provider.findChannelIdByUsername(reference.value()));
            case CUSTOM_NAME -> call(retryTemplate, SEARCH_COST, "search.list",
                    () -> provider.searchChannelId(reference.value()));
            case CHANNEL_ID -> Optional.of(reference.value());
        };
        String channelId = resolved.orElseThrow(() -> new ChannelNotFoundException(reference.original()));
        cache.put(CacheNamespace.CHANNEL_URL, reference.cacheKey(), channelId, cacheProperties.urlMappingTtl());
        log.debug("Resolved {} to {}", reference.original(), channelId);
        return channelId;
    }

    public Optional<String> cachedChannelId(ChannelReference reference) {
        if (reference.isChannelId()) {
            return Optional.of(reference.value());
        }
        return cache.get(CacheNamespace.CHANNEL_URL, reference.cacheKey(), String.class);
    }

    private <T> T call(RetryTemplate template, long cost, String operation, Supplier<T> request) {
        provider.checkConfigured();
        return template.execute(context -> {
            ledger.reserve(cost);
            try {
                return request.get();
            } catch (ProviderException ex) {
                if (!ex.isRetryable()) {
                    context.setExhaustedOnly();
                } else {
                    log.warn("{} attempt {} failed: {}", operation, context.getRetryCount() + 1, ex.getMessage());
                }
                throw ex;
            }
        });
    }

    record VideoList(List<VideoRecord> videos) {
    }
}
