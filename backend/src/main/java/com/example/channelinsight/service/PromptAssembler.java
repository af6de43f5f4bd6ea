package com.example.channelinsight.service;

import com.example.channelinsight.util.TextNormalizer;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class PromptAssembler {

    static final int CHANNEL_DESCRIPTION_LIMIT = 500;
    static final int VIDEO_DESCRIPTION_LIMIT = 200;
    static final int TAG_LIMIT = 5;

    static final String SYSTEM_INSTRUCTION = "You are a YouTube analytics expert. Analyze channel data and "
            + "provide factual, concise insights in valid JSON format. Do not hallucinate or make "
            + "assumptions beyond the provided data.";

    static final String TASK = """
            Based on the channel and video data above, provide a comprehensive analysis in the following JSON format:

            {
              "summary": "A concise 3-paragraph summary describing what this channel is about, its main focus, and value proposition",
              "themes": ["theme1", "theme2", "theme3", "theme4", "theme5"],
              "target_audience": "Detailed description of the primary target audience",
              "content_style": "Description of the content style, tone, and presentation approach",
              "upload_frequency": "Estimated upload frequency pattern (e.g., 'daily', '2-3 times per week', 'weekly', 'irregular')",
              "confidence_score": 0.95
            }

            Important guidelines:
            1. Base your analysis ONLY on the provided data - do not hallucinate
            2. The summary should be factual and insightful
            3. Themes should be specific topics or categories covered
            4. Confidence score should reflect data quality (0.0-1.0)
            5. Return ONLY valid JSON, no additional text
            """;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    public AnalysisPrompt build(ChannelRecord channel, List<VideoRecord> sample) {
        StringBuilder content = new StringBuilder(4096 + sample.size() * 512);

        content.append("Channel Information:\n");
        line(content, "Title", orUnknown(channel.title()));
        line(content, "Description", TextNormalizer.truncate(orNa(channel.description()), CHANNEL_DESCRIPTION_LIMIT));
        line(content, "Subscriber Count", number(channel.subscriberCount()));
        line(content, "Total Videos", number(channel.videoCount()));
        line(content, "Active Since", date(channel.publishedAt()));
        line(content, "Country", orUnknown(channel.country()));
        content.append('\n');

        content.append("Video Sample Analysis (").append(sample.size()).append(" representative videos):\n\n");
        int position = 1;
        for (VideoRecord video : sample) {
            content.append("Video ").append(position++).append(":\n");
            line(content, "Title", orUnknown(video.title()));
            line(content, "Description", TextNormalizer.truncate(orNa(video.description()), VIDEO_DESCRIPTION_LIMIT));
            line(content, "Views", number(video.viewCount()));
            line(content, "Likes", number(video.likeCount()));
            line(content, "Published", date(video.publishedAt()));
            line(content, "Duration", duration(video.durationSec()));
            line(content, "Tags", String.join(", ", video.tags().subList(0, Math.min(TAG_LIMIT, video.tags().size()))));
            content.append('\n');
        }

        content.append(TASK);
        return new AnalysisPrompt(SYSTEM_INSTRUCTION, content.toString());
    }

    private static void line(StringBuilder out, String label, String value) {
        out.append("- ").append(label).append(": ").append(value).append('\n');
    }

    private static String number(Long value) {
        return value == null ? "Unknown" : String.format(Locale.ROOT, "%,d", value);
    }

    private static String number(long value) {
        return String.format(Locale.ROOT, "%,d", value);
    }

    private static String date(Instant instant) {
        return instant == null ? "Unknown" : DATE.format(instant);
    }

    static String duration(Integer seconds) {
        if (seconds == null || seconds <= 0) {
            return "Unknown";
        }
        int hours = seconds / 3600;
        int minutes = (seconds % 3600) / 60;
        int secs = seconds % 60;
        return hours > 0
                ? String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, secs)
                : String.format(Locale.ROOT, "%d:%02d", minutes, secs);
    }

    private static String orUnknown(String value) {
        return TextNormalizer.hasText(value) ? value.trim() : "Unknown";
    }

    private static String orNa(String value) {
        return TextNormalizer.hasText(value) ? value : "N/A";
    }
}
