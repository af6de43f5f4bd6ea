package com.example.channelinsight.service;

import com.example.channelinsight.config.AnalysisProperties;
import com.example.channelinsight.exception.ProviderException;
import com.example.channelinsight.util.TextNormalizer;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class YouTubeApiMetadataProvider implements MetadataProvider {

    static final String PROVIDER = "youtube";
    static final int MAX_RESULTS = 50;

    private static final Logger log = LoggerFactory.getLogger(YouTubeApiMetadataProvider.class);
    private static final Pattern ISO_8601_DURATION = Pattern.compile(
            "P(?:(\\d+)D)?T?(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?",
            Pattern.CASE_INSENSITIVE);

    private final RestClient restClient;
    private final String apiKey;
    private final Clock clock;

    public YouTubeApiMetadataProvider(@Qualifier("youTubeRestClient") RestClient restClient,
                                      AnalysisProperties properties,
                                      Clock clock) {
        this.restClient = restClient;
        String configuredKey = properties.youtube().apiKey();
        this.apiKey = configuredKey == null ? "" : configuredKey.trim();
        this.clock = clock;
    }

    @Override
    public Optional<ChannelRecord> fetchChannel(String channelId) {
        checkConfigured();
        ChannelsResponse response = call("channels.list", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/channels")
                        .queryParam("part", "snippet,statistics,contentDetails")
                        .queryParam("id", channelId)
                        .queryParam("key", apiKey)
                        .build())
                .retrieve()
                .body(ChannelsResponse.class));

        if (response == null || response.items() == null || response.items().isEmpty()) {
            return Optional.empty();
        }
        ChannelItem item = response.items().get(0);
        if (item == null || item.id() == null) {
            return Optional.empty();
        }
        return Optional.of(toChannelRecord(item));
    }

    @Override
    public VideoPage fetchUploadsPage(String uploadsPlaylistId, String pageToken) {
        checkConfigured();
        PlaylistItemsResponse response;
        try {
            response = restClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("/playlistItems")
                                .queryParam("part", "snippet,contentDetails")
                                .queryParam("playlistId", uploadsPlaylistId)
                                .queryParam("maxResults", MAX_RESULTS)
                                .queryParam("key", apiKey);
                        if (TextNormalizer.hasText(pageToken)) {
                            uriBuilder.queryParam("pageToken", pageToken);
                        }
                        return uriBuilder.build();
                    })
                    .retrieve()
                    .body(PlaylistItemsResponse.class);
        } catch (RestClientResponseException ex) {
            // A channel without any upload has no uploads playlist.
            if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.info("Uploads playlist {} not found; treating it as empty", uploadsPlaylistId);
                return new VideoPage(List.of(), null);
            }
            throw ProviderErrors.translate(PROVIDER, "playlistItems.list", ex);
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(PROVIDER, "playlistItems.list", ex);
        }

        if (response == null || response.items() == null) {
            return new VideoPage(List.of(), null);
        }
        List<VideoRecord> videos = new ArrayList<>(response.items().size());
        for (PlaylistItem item : response.items()) {
            VideoRecord video = toListedVideo(item);
            if (video != null) {
                videos.add(video);
            }
        }
        return new VideoPage(videos, TextNormalizer.trimToNull(response.nextPageToken()));
    }

    @Override
    public List<VideoRecord> fetchVideoDetails(List<String> videoIds) {
        if (videoIds.isEmpty()) {
            return List.of();
        }
        if (videoIds.size() > MAX_RESULTS) {
            throw new IllegalArgumentException("At most " + MAX_RESULTS + " ids per request");
        }
        checkConfigured();
        String ids = String.join(",", videoIds);
        VideosResponse response = call("videos.list", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/videos")
                        .queryParam("part", "snippet,statistics,contentDetails")
                        .queryParam("id", ids)
                        .queryParam("maxResults", MAX_RESULTS)
                        .queryParam("key", apiKey)
                        .build())
                .retrieve()
                .body(VideosResponse.class));

        if (response == null || response.items() == null) {
            return List.of();
        }
        List<VideoRecord> details = new ArrayList<>(response.items().size());
        for (VideoItem item : response.items()) {
            if (item == null || item.id() == null) {
                continue;
            }
            VideoSnippet snippet = item.snippet();
            Statistics statistics = item.statistics();
            details.add(new VideoRecord(
                    item.id(),
                    snippet != null ? snippet.channelId() : null,
                    snippet != null ? TextNormalizer.trimToNull(snippet.title()) : null,
                    snippet != null ? snippet.description() : null,
                    snippet != null ? parseInstant(snippet.publishedAt()) : null,
                    item.contentDetails() != null ? parseDuration(item.contentDetails().duration()) : null,
                    statistics != null ? parseCount(statistics.viewCount()) : null,
                    statistics != null ? parseCount(statistics.likeCount()) : null,
                    statistics != null ? parseCount(statistics.commentCount()) : null,
                    snippet != null ? snippet.tags() : List.of(),
                    snippet != null ? snippet.categoryId() : null,
                    true));
        }
        return details;
    }

    @Override
    public Optional<String> findChannelIdByHandle(String handle) {
        checkConfigured();
        String query = handle.startsWith("@") ? handle : '@' + handle;
        ChannelsResponse response = call("channels.list", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/channels")
                        .queryParam("part", "id")
                        .queryParam("forHandle", query)
                        .queryParam("key", apiKey)
                        .build())
                .retrieve()
                .body(ChannelsResponse.class));
        return firstChannelId(response);
    }

    @Override
    public Optional<String> findChannelIdByUsername(String username) {
        checkConfigured();
        ChannelsResponse response = call("channels.list", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/channels")
                        .queryParam("part", "id")
                        .queryParam("forUsername", username)
                        .queryParam("key", apiKey)
                        .build())
                .retrieve()
                .body(ChannelsResponse.class));
        return firstChannelId(response);
    }

    @Override
    public Optional<String> searchChannelId(String query) {
        checkConfigured();
        SearchResponse response = call("search.list", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/search")
                        .queryParam("part", "snippet")
                        .queryParam("type", "channel")
                        .queryParam("maxResults", 1)
                        .queryParam("q", query)
                        .queryParam("key", apiKey)
                        .build())
                .retrieve()
                .body(SearchResponse.class));
        if (response == null || response.items() == null) {
            return Optional.empty();
        }
        for (SearchItem item : response.items()) {
            String channelId = item == null || item.id() == null ? null : TextNormalizer.trimToNull(item.id().channelId());
            if (channelId != null) {
                return Optional.of(channelId);
            }
        }
        return Optional.empty();
    }

    private <T> T call(String operation, RestCall<T> call) {
        try {
            return call.execute();
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(PROVIDER, operation, ex);
        }
    }

    @Override
    public void checkConfigured() {
        if (apiKey.isBlank()) {
            log.warn("YouTube API key is not configured; metadata requests are unavailable.");
            throw new ProviderException(PROVIDER, "API key is not configured", false, false, null);
        }
    }

    private ChannelRecord toChannelRecord(ChannelItem item) {
        ChannelSnippet snippet = item.snippet();
        Statistics statistics = item.statistics();
        String uploads = item.contentDetails() != null && item.contentDetails().relatedPlaylists() != null
                ? item.contentDetails().relatedPlaylists().uploads()
                : null;
        if (uploads == null && item.id().startsWith("UC")) {
            // Uploads playlist id is derived from the channel id when the part is omitted.
            uploads = "UU" + item.id().substring(2);
        }
        return new ChannelRecord(
                item.id(),
                snippet != null ? TextNormalizer.trimToNull(snippet.title()) : null,
                snippet != null ? snippet.description() : null,
                snippet != null ? TextNormalizer.trimToNull(snippet.customUrl()) : null,
                snippet != null ? TextNormalizer.trimToNull(snippet.country()) : null,
                snippet != null ? resolveThumbnailUrl(snippet.thumbnails()) : null,
                snippet != null ? parseInstant(snippet.publishedAt()) : null,
                statistics != null ? orZero(parseCount(statistics.subscriberCount())) : 0L,
                statistics != null ? orZero(parseCount(statistics.videoCount())) : 0L,
                statistics != null ? orZero(parseCount(statistics.viewCount())) : 0L,
                uploads,
                clock.instant());
    }

    private VideoRecord toListedVideo(PlaylistItem item) {
        if (item == null) {
            return null;
        }
        PlaylistSnippet snippet = item.snippet();
        String videoId = item.contentDetails() != null ? item.contentDetails().videoId() : null;
        if (videoId == null && snippet != null && snippet.resourceId() != null) {
            videoId = snippet.resourceId().videoId();
        }
        if (videoId == null) {
            return null;
        }
        Instant publishedAt = item.contentDetails() != null ? parseInstant(item.contentDetails().videoPublishedAt()) : null;
        if (publishedAt == null && snippet != null) {
            publishedAt = parseInstant(snippet.publishedAt());
        }
        return VideoRecord.listed(
                videoId,
                snippet != null ? snippet.channelId() : null,
                snippet != null ? TextNormalizer.trimToNull(snippet.title()) : null,
                snippet != null ? snippet.description() : null,
                publishedAt);
    }

    private Optional<String> firstChannelId(ChannelsResponse response) {
        if (response == null || response.items() == null) {
            return Optional.empty();
        }
        return response.items().stream()
                .filter(item -> item != null && TextNormalizer.hasText(item.id()))
                .map(ChannelItem::id)
                .findFirst();
    }

    static Integer parseDuration(String duration) {
        if (duration == null || duration.isBlank()) {
            return null;
        }
        Matcher matcher = ISO_8601_DURATION.matcher(duration.trim());
        if (!matcher.matches()) {
            return null;
        }
        int days = parseInt(matcher.group(1));
        int hours = parseInt(matcher.group(2));
        int minutes = parseInt(matcher.group(3));
        int seconds = parseInt(matcher.group(4));
        int total = days * 86400 + hours * 3600 + minutes * 60 + seconds;
        return total > 0 ? total : null;
    }

    private static int parseInt(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static Long parseCount(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private String resolveThumbnailUrl(Thumbnails thumbnails) {
        if (thumbnails == null) {
            return null;
        }
        ThumbnailInfo[] candidates = new ThumbnailInfo[] {
                thumbnails.high(),
                thumbnails.medium(),
                thumbnails.defaultThumbnail()
        };
        for (ThumbnailInfo candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            String url = TextNormalizer.trimToNull(candidate.url());
            if (url != null) {
                return url;
            }
        }
        return null;
    }

    @FunctionalInterface
    private interface RestCall<T> {
        T execute();
    }

    private record ChannelsResponse(List<ChannelItem> items) {
    }

    private record ChannelItem(String id,
                               ChannelSnippet snippet,
                               Statistics statistics,
                               ChannelContentDetails contentDetails) {
    }

    private record ChannelSnippet(String title,
                                  String description,
                                  String customUrl,
                                  String country,
                                  String publishedAt,
                                  Thumbnails thumbnails) {
    }

    private record ChannelContentDetails(RelatedPlaylists relatedPlaylists) {
    }

    private record RelatedPlaylists(String uploads) {
    }

    private record Statistics(String viewCount,
                              String likeCount,
                              String commentCount,
                              String subscriberCount,
                              String videoCount) {
    }

    private record PlaylistItemsResponse(String nextPageToken, List<PlaylistItem> items) {
    }

    private record PlaylistItem(PlaylistSnippet snippet, PlaylistContentDetails contentDetails) {
    }

    private record PlaylistSnippet(String title,
                                   String description,
                                   String channelId,
                                   String publishedAt,
                                   ResourceId resourceId) {
    }

    private record ResourceId(String videoId) {
    }

    private record PlaylistContentDetails(String videoId, String videoPublishedAt) {
    }

    private record VideosResponse(List<VideoItem> items) {
    }

    private record VideoItem(String id,
                             VideoSnippet snippet,
                             Statistics statistics,
                             VideoContentDetails contentDetails) {
    }

    private record VideoSnippet(String title,
                                String description,
                                String channelId,
                                String publishedAt,
                                List<String> tags,
                                String categoryId) {
    }

    private record VideoContentDetails(String duration) {
    }

    private record SearchResponse(List<SearchItem> items) {
    }

    private record SearchItem(SearchId id) {
    }

    private record SearchId(String channelId) {
    }

    private record Thumbnails(
            @JsonProperty("default") ThumbnailInfo defaultThumbnail,
            ThumbnailInfo medium,
            ThumbnailInfo high) {
    }

    private record ThumbnailInfo(String url) {
    }
}
