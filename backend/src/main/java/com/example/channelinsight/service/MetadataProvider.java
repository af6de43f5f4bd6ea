package com.example.channelinsight.service;

import java.util.List;
import java.util.Optional;

public interface MetadataProvider {

    // Throws a non-retryable ProviderException when no request could succeed, e.g. a missing key.
    void checkConfigured();

    Optional<ChannelRecord> fetchChannel(String channelId);

    VideoPage fetchUploadsPage(String uploadsPlaylistId, String pageToken);

    List<VideoRecord> fetchVideoDetails(List<String> videoIds);

    Optional<String> findChannelIdByHandle(String handle);

    Optional<String> findChannelIdByUsername(String username);

    Optional<String> searchChannelId(String query);
}
