package com.example.channelinsight.util;

import java.text.Normalizer;
import java.util.Locale;

public final class TextNormalizer {

    private TextNormalizer() {
    }

    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(trimmed, Normalizer.Form.NFKD);
        String withoutMarks = decomposed.replaceAll("\\p{M}", "");
        String lowerCased = withoutMarks.toLowerCase(Locale.ROOT);
        String alnumAndSpaceOnly = lowerCased.replaceAll("[^\\p{Alnum}\\s]", " ");
        return alnumAndSpaceOnly.replaceAll("\\s+", " ").trim();
    }

    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String collapsed = value.replaceAll("\\s+", " ").trim();
        if (collapsed.length() <= maxLength) {
            return collapsed;
        }
        if (maxLength <= 3) {
            return collapsed.substring(0, maxLength);
        }
        return collapsed.substring(0, maxLength - 3).trim() + "...";
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
