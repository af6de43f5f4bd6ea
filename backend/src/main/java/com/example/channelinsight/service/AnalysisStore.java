package com.example.channelinsight.service;

import com.example.channelinsight.dto.AnalysisHistoryResponse;
import com.example.channelinsight.model.Channel;
import com.example.channelinsight.model.ChannelAnalysis;
import com.example.channelinsight.model.ChannelAnalysisHistory;
import com.example.channelinsight.model.Video;
import com.example.channelinsight.repository.ChannelAnalysisHistoryRepository;
import com.example.channelinsight.repository.ChannelAnalysisRepository;
import com.example.channelinsight.repository.ChannelRepository;
import com.example.channelinsight.repository.VideoRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AnalysisStore {

    private static final Logger log = LoggerFactory.getLogger(AnalysisStore.class);

    private final ChannelRepository channelRepository;
    private final VideoRepository videoRepository;
    private final ChannelAnalysisRepository analysisRepository;
    private final ChannelAnalysisHistoryRepository historyRepository;
    private final Clock clock;

    public AnalysisStore(ChannelRepository channelRepository,
                         VideoRepository videoRepository,
                         ChannelAnalysisRepository analysisRepository,
                         ChannelAnalysisHistoryRepository historyRepository,
                         Clock clock) {
        this.channelRepository = channelRepository;
        this.videoRepository = videoRepository;
        this.analysisRepository = analysisRepository;
        this.historyRepository = historyRepository;
        this.clock = clock;
    }

    @Transactional
    public void save(AnalysisOutcome outcome) {
        upsertChannel(outcome.channel());
        upsertVideos(outcome.channel().channelId(), outcome.sample());
        replaceAnalysis(outcome.analysis());
        log.debug("Stored analysis of {}", outcome.analysis().channelId());
    }

    @Transactional(readOnly = true)
    public Optional<AnalysisRecord> findAnalysis(String channelId) {
        return analysisRepository.findByChannelId(channelId).map(AnalysisStore::toAnalysisRecord);
    }

    @Transactional(readOnly = true)
    public Optional<ChannelRecord> findChannel(String channelId) {
        return channelRepository.findByChannelId(channelId).map(AnalysisStore::toChannelRecord);
    }

    @Transactional(readOnly = true)
    public Optional<String> findChannelIdByCustomUrl(String name) {
        String bare = name.startsWith("@") ? name.substring(1) : name;
        return channelRepository.findFirstByCustomUrlIgnoreCase("@" + bare)
                .or(() -> channelRepository.findFirstByCustomUrlIgnoreCase(bare))
                .map(Channel::getChannelId);
    }

    @Transactional(readOnly = true)
    public List<AnalysisHistoryResponse> history(String channelId) {
        return historyRepository.findByChannelIdOrderByAnalyzedAtDesc(channelId).stream()
                .map(entry -> new AnalysisHistoryResponse(
                        entry.getAnalyzedAt(),
                        entry.getExpiresAt(),
                        entry.getModelVersion(),
                        entry.getConfidence(),
                        entry.isDegraded(),
                        entry.getArchivedAt()))
                .toList();
    }

    private void upsertChannel(ChannelRecord record) {
        Channel channel = channelRepository.findByChannelId(record.channelId())
                .orElseGet(() -> new Channel(record.channelId()));
        channel.setTitle(record.title());
        channel.setDescription(record.description());
        channel.setCustomUrl(record.customUrl());
        channel.setCountry(record.country());
        channel.setThumbnailUrl(record.thumbnailUrl());
        channel.setPublishedAt(record.publishedAt());
        channel.setSubscriberCount(record.subscriberCount());
        channel.setVideoCount(record.videoCount());
        channel.setViewCount(record.viewCount());
        channel.setUploadsPlaylistId(record.uploadsPlaylistId());
        channel.setFetchedAt(record.fetchedAt());
        channelRepository.save(channel);
    }

    private void upsertVideos(String channelId, List<VideoRecord> videos) {
        if (videos.isEmpty()) {
            return;
        }
        Map<String, Video> existing = videoRepository.findByVideoIdIn(videos.stream().map(VideoRecord::videoId).toList())
                .stream()
                .collect(Collectors.toMap(Video::getVideoId, Function.identity(), (first, second) -> first, HashMap::new));
        List<Video> toSave = new ArrayList<>(videos.size());
        for (VideoRecord record : videos) {
            Video video = existing.get(record.videoId());
            if (video == null) {
                video = new Video(record.videoId(), record.channelId() != null ? record.channelId() : channelId);
                existing.put(record.videoId(), video);
            }
            video.setTitle(record.title());
            video.setDescription(record.description());
            video.setPublishedAt(record.publishedAt());
            // Unenriched records must not wipe statistics stored by an earlier, successful run.
            if (record.detailsAvailable() || !video.isDetailsAvailable()) {
                video.setDurationSec(record.durationSec());
                video.setViewCount(record.viewCount());
                video.setLikeCount(record.likeCount());
                video.setCommentCount(record.commentCount());
                video.setCategoryId(record.categoryId());
                video.setTags(record.tags());
                video.setDetailsAvailable(record.detailsAvailable());
            }
            toSave.add(video);
        }
        videoRepository.saveAll(toSave);
    }

    private void replaceAnalysis(AnalysisRecord record) {
        Optional<ChannelAnalysis> current = analysisRepository.findByChannelId(record.channelId());
        ChannelAnalysis analysis;
        if (current.isPresent()) {
            analysis = current.get();
            historyRepository.save(new ChannelAnalysisHistory(analysis, clock.instant()));
        } else {
            analysis = new ChannelAnalysis(record.channelId());
        }
        analysis.setSummary(record.summary());
        analysis.setThemes(record.themes());
        analysis.setTargetAudience(record.targetAudience());
        analysis.setContentStyle(record.contentStyle());
        analysis.setUploadFrequency(record.uploadFrequency());
        analysis.setVideoSampleIds(record.videoSampleIds());
        analysis.setAnalyzedVideosCount(record.analyzedVideosCount());
        analysis.setTotalVideosCount(record.totalVideosCount());
        analysis.setConfidence(record.confidence());
        analysis.setModelVersion(record.modelVersion());
        analysis.setSamplingStrategy(record.samplingStrategy());
        analysis.setDegraded(record.degraded());
        analysis.setAnalyzedAt(record.analyzedAt());
        analysis.setExpiresAt(record.expiresAt());
        analysisRepository.save(analysis);
    }

    static AnalysisRecord toAnalysisRecord(ChannelAnalysis analysis) {
        return new AnalysisRecord(
                analysis.getChannelId(),
                analysis.getSummary(),
                analysis.getThemes(),
                analysis.getTargetAudience(),
                analysis.getContentStyle(),
                analysis.getUploadFrequency(),
                analysis.getVideoSampleIds(),
                analysis.getAnalyzedVideosCount(),
                analysis.getTotalVideosCount(),
                analysis.getConfidence(),
                analysis.getModelVersion(),
                analysis.getSamplingStrategy(),
                analysis.isDegraded(),
                analysis.getAnalyzedAt(),
                analysis.getExpiresAt());
    }

    static ChannelRecord toChannelRecord(Channel channel) {
        return new ChannelRecord(
                channel.getChannelId(),
                channel.getTitle(),
                channel.getDescription(),
                channel.getCustomUrl(),
                channel.getCountry(),
                channel.getThumbnailUrl(),
                channel.getPublishedAt(),
                channel.getSubscriberCount(),
                channel.getVideoCount(),
                channel.getViewCount(),
                channel.getUploadsPlaylistId(),
                channel.getFetchedAt());
    }
}
