package com.example.channelinsight.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

@Component
public class VideoSampler {

    public static final int DEFAULT_MAX_SAMPLE = 50;

    private static final int SMALL_CHANNEL_LIMIT = 50;
    private static final int LARGE_CHANNEL_LIMIT = 500;

    private static final Comparator<VideoRecord> NEWEST_FIRST = Comparator
            .comparing(VideoRecord::publishedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(VideoRecord::videoId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    public VideoSample sample(List<VideoRecord> videos, int maxSample) {
        if (maxSample <= 0) {
            return new VideoSample(List.of(), SamplingStrategy.ALL_VIDEOS);
        }
        List<VideoRecord> ordered = newestFirst(videos);
        int total = ordered.size();

        if (total < SMALL_CHANNEL_LIMIT) {
            return new VideoSample(ordered.subList(0, Math.min(total, maxSample)), SamplingStrategy.ALL_VIDEOS);
        }

        SamplingStrategy strategy;
        int recentQuota;
        int spreadQuota;
        if (total < LARGE_CHANNEL_LIMIT) {
            strategy = SamplingStrategy.RECENT_DISTRIBUTED;
            recentQuota = 30;
            spreadQuota = 20;
        } else {
            strategy = SamplingStrategy.LARGE_CHANNEL;
            recentQuota = 25;
            spreadQuota = 25;
        }

        int planned = recentQuota + spreadQuota;
        int target = Math.min(Math.min(planned, maxSample), total);
        if (target < planned) {
            recentQuota = (int) Math.round((double) target * recentQuota / planned);
            spreadQuota = target - recentQuota;
        }

        TreeSet<Integer> picked = new TreeSet<>();
        for (int i = 0; i < recentQuota; i++) {
            picked.add(i);
        }
        for (int index : evenlySpaced(total, spreadQuota)) {
            picked.add(index);
        }
        // backfill collisions with the next most recent videos
        for (int i = 0; picked.size() < target && i < total; i++) {
            picked.add(i);
        }

        List<VideoRecord> selected = new ArrayList<>(picked.size());
        for (int index : picked) {
            selected.add(ordered.get(index));
        }
        return new VideoSample(selected, strategy);
    }

    public VideoSample sample(List<VideoRecord> videos) {
        return sample(videos, DEFAULT_MAX_SAMPLE);
    }

    static List<Integer> evenlySpaced(int total, int count) {
        List<Integer> positions = new ArrayList<>(count);
        if (count <= 0 || total <= 0) {
            return positions;
        }
        if (count == 1) {
            positions.add(0);
            return positions;
        }
        double step = (double) (total - 1) / (count - 1);
        for (int i = 0; i < count; i++) {
            positions.add((int) Math.round(i * step));
        }
        return positions;
    }

    private static List<VideoRecord> newestFirst(List<VideoRecord> videos) {
        Map<String, VideoRecord> unique = new LinkedHashMap<>();
        for (VideoRecord video : videos) {
            if (video != null && video.videoId() != null) {
                unique.putIfAbsent(video.videoId(), video);
            }
        }
        List<VideoRecord> ordered = new ArrayList<>(unique.values());
        ordered.sort(NEWEST_FIRST);
        return ordered;
    }
}
