package com.example.channelinsight.service;

import com.example.channelinsight.util.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class DegradedAnalysisBuilder {

    static final String MODEL_VERSION = "metadata-only";
    static final double CONFIDENCE = 0.2;
    static final int MAX_THEMES = 5;

    private final UploadFrequencyEstimator frequencyEstimator;

    public DegradedAnalysisBuilder(UploadFrequencyEstimator frequencyEstimator) {
        this.frequencyEstimator = frequencyEstimator;
    }

    public GeneratedAnalysis build(ChannelRecord channel, List<VideoRecord> sample) {
        String title = TextNormalizer.hasText(channel.title()) ? channel.title().trim() : channel.channelId();
        StringBuilder summary = new StringBuilder();
        summary.append(title)
                .append(" is a YouTube channel with ")
                .append(String.format(Locale.ROOT, "%,d", channel.subscriberCount()))
                .append(" subscribers and ")
                .append(String.format(Locale.ROOT, "%,d", channel.videoCount()))
                .append(" videos.");
        if (TextNormalizer.hasText(channel.description())) {
            summary.append(' ').append(TextNormalizer.truncate(channel.description(), 500));
        }
        summary.append(" This summary was built from channel metadata only.");

        return new GeneratedAnalysis(
                summary.toString(),
                topTags(sample),
                AnalysisGenerator.UNKNOWN,
                AnalysisGenerator.UNKNOWN,
                frequencyEstimator.estimate(sample),
                CONFIDENCE,
                MODEL_VERSION);
    }

    static List<String> topTags(List<VideoRecord> sample) {
        Map<String, String> display = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (VideoRecord video : sample) {
            for (String tag : video.tags()) {
                String key = TextNormalizer.normalize(tag);
                if (key == null || key.isEmpty()) {
                    continue;
                }
                display.putIfAbsent(key, tag.trim());
                counts.merge(key, 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        List<String> themes = new ArrayList<>(MAX_THEMES);
        for (Map.Entry<String, Integer> entry : ranked) {
            if (themes.size() == MAX_THEMES) {
                break;
            }
            themes.add(display.get(entry.getKey()));
        }
        return themes;
    }
}
