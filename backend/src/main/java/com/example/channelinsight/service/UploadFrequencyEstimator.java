package com.example.channelinsight.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class UploadFrequencyEstimator {

    static final String UNKNOWN = "Unknown";

    public String estimate(List<VideoRecord> videos) {
        List<Instant> dates = new ArrayList<>(videos.stream()
                .map(VideoRecord::publishedAt)
                .filter(Objects::nonNull)
                .distinct()
                .toList());
        if (dates.size() < 3) {
            return UNKNOWN;
        }
        Collections.sort(dates);

        List<Long> gaps = new ArrayList<>(dates.size() - 1);
        for (int i = 1; i < dates.size(); i++) {
            gaps.add(Duration.between(dates.get(i - 1), dates.get(i)).toHours());
        }
        Collections.sort(gaps);
        double medianDays = median(gaps) / 24.0;

        if (medianDays <= 1.5) {
            return "daily";
        }
        if (medianDays <= 4) {
            return "2-3 times per week";
        }
        if (medianDays <= 10) {
            return "weekly";
        }
        if (medianDays <= 45) {
            return "monthly";
        }
        return "irregular";
    }

    private static double median(List<Long> sorted) {
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        return (sorted.get(middle - 1) + sorted.get(middle)) / 2.0;
    }
}
