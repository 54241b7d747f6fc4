package com.jobscout.discovery.util;

import java.util.Locale;

public final class TextUtils {
    private TextUtils() {
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return null;
        }
        return value.replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
    }

    public static String clean(String value, int maxLength) {
        String collapsed = collapseWhitespace(value);
        if (collapsed == null || collapsed.isEmpty()) {
            return null;
        }
        return truncate(collapsed, maxLength);
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength).trim();
    }

    public static String normalizeKey(String value) {
        String collapsed = collapseWhitespace(value);
        return collapsed == null ? "" : collapsed.toLowerCase(Locale.ROOT);
    }
}
