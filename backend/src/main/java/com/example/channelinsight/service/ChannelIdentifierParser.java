package com.example.channelinsight.service;

import com.example.channelinsight.exception.InvalidIdentifierException;
import com.example.channelinsight.util.TextNormalizer;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class ChannelIdentifierParser {

    static final Pattern CHANNEL_ID_PATTERN = Pattern.compile("^UC[0-9A-Za-z_-]{22}$");
    private static final Pattern HANDLE_PATTERN = Pattern.compile("^[0-9A-Za-z._-]{3,30}$");
    private static final String[] YOUTUBE_HOST_SUFFIXES = {"youtube.com", "youtu.be"};

    public ChannelReference parse(String value) {
        String trimmed = TextNormalizer.trimToNull(value);
        if (trimmed == null) {
            throw new InvalidIdentifierException(String.valueOf(value));
        }

        if (CHANNEL_ID_PATTERN.matcher(trimmed).matches()) {
            return new ChannelReference(ChannelReference.Kind.CHANNEL_ID, trimmed, trimmed);
        }

        if (trimmed.startsWith("@")) {
            return handle(trimmed.substring(1), trimmed);
        }

        if (!trimmed.contains("/") && !trimmed.contains(".")) {
            return handle(trimmed, trimmed);
        }

        URI parsed = tryParseUrl(trimmed);
        if (parsed == null || parsed.getHost() == null || !isYouTubeHost(parsed.getHost())) {
            throw new InvalidIdentifierException(trimmed);
        }

        String path = parsed.getPath();
        String[] segments = path == null ? new String[0] : Arrays.stream(path.split("/"))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toArray(String[]::new);
        if (segments.length == 0) {
            throw new InvalidIdentifierException(trimmed);
        }

        String first = segments[0];
        String second = segments.length > 1 ? segments[1] : null;

        if (first.startsWith("@")) {
            return handle(first.substring(1), trimmed);
        }
        if ("channel".equalsIgnoreCase(first) && second != null
                && CHANNEL_ID_PATTERN.matcher(second).matches()) {
            return new ChannelReference(ChannelReference.Kind.CHANNEL_ID, second, trimmed);
        }
        if ("user".equalsIgnoreCase(first) && second != null) {
            return new ChannelReference(ChannelReference.Kind.USERNAME, second, trimmed);
        }
        if ("c".equalsIgnoreCase(first) && second != null) {
            return new ChannelReference(ChannelReference.Kind.CUSTOM_NAME, second, trimmed);
        }
        if (segments.length == 1 && !isReservedPath(first)) {
            return new ChannelReference(ChannelReference.Kind.CUSTOM_NAME, first, trimmed);
        }
        throw new InvalidIdentifierException(trimmed);
    }

    private ChannelReference handle(String handle, String original) {
        if (!HANDLE_PATTERN.matcher(handle).matches()) {
            throw new InvalidIdentifierException(original);
        }
        return new ChannelReference(ChannelReference.Kind.HANDLE, handle, original);
    }

    private boolean isReservedPath(String segment) {
        String lower = segment.toLowerCase(Locale.ROOT);
        return lower.equals("watch") || lower.equals("playlist") || lower.equals("results")
                || lower.equals("shorts") || lower.equals("feed") || lower.equals("channel");
    }

    private URI tryParseUrl(String value) {
        String candidate = value.contains("://") ? value : "https://" + value;
        try {
            return new URI(candidate);
        } catch (URISyntaxException ex) {
            return null;
        }
    }

    private boolean isYouTubeHost(String host) {
        String lower = host.toLowerCase(Locale.ROOT);
        for (String suffix : YOUTUBE_HOST_SUFFIXES) {
            if (lower.equals(suffix) || lower.endsWith('.' + suffix)) {
                return true;
            }
        }
        return false;
    }
}
