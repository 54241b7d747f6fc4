package com.jobscout.discovery.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class JobUrlUtils {
    private static final List<String> PLACEHOLDER_HREFS = List.of("#", "#!", "javascript:void(0)", "javascript:void(0);");

    private JobUrlUtils() {
    }

    public static boolean isPlaceholderHref(String href) {
        if (href == null || href.isBlank()) {
            return true;
        }
        String lower = href.trim().toLowerCase(Locale.ROOT);
        return PLACEHOLDER_HREFS.contains(lower) || lower.startsWith("javascript:");
    }

    public static boolean isHttpUrl(String url) {
        URI uri = safeUri(url == null ? null : url.trim());
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    public static String absolutize(String baseUrl, String href) {
        if (isPlaceholderHref(href)) {
            return null;
        }
        String trimmed = href.trim();
        URI target = safeUri(trimmed);
        if (target == null) {
            return null;
        }
        if (target.isAbsolute()) {
            return trimmed;
        }
        URI base = safeUri(baseUrl);
        if (base == null || !base.isAbsolute()) {
            return null;
        }
        try {
            return base.resolve(target).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static String hostOf(String url) {
        URI uri = safeUri(url == null ? null : url.trim());
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static boolean isOnDomain(String url, String domain) {
        String host = hostOf(url);
        if (host == null || domain == null || domain.isBlank()) {
            return false;
        }
        String normalizedDomain = domain.trim().toLowerCase(Locale.ROOT);
        return host.equals(normalizedDomain) || host.endsWith("." + normalizedDomain);
    }

    /**
     * Lowercases scheme and host, drops the fragment, tracking parameters and a trailing slash so
     * that the same posting reached through different links compares equal.
     */
    public static String normalizeForFingerprint(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String trimmed = url.trim();
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(host);
        if (uri.getPort() > 0 && !isDefaultPort(scheme, uri.getPort())) {
            out.append(':').append(uri.getPort());
        }
        out.append(path);
        String query = stripTrackingParams(uri.getRawQuery());
        if (!query.isEmpty()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String stripTrackingParams(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (part.isBlank()) {
                continue;
            }
            String name = part.split("=", 2)[0].toLowerCase(Locale.ROOT);
            if (name.startsWith("utm_") || name.equals("gclid") || name.equals("fbclid")) {
                continue;
            }
            kept.add(part);
        }
        return String.join("&", kept);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
