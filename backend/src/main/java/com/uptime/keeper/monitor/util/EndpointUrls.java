package com.uptime.keeper.monitor.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class EndpointUrls {

    private EndpointUrls() {
    }

    /**
     * Trims the candidate and prefixes {@code https://} when no scheme is given.
     * Returns null for blank input.
     */
    public static String normalize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String value = candidate.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            value = "https://" + value;
        }
        return value;
    }

    public static boolean isValidHttpUrl(String candidate) {
        URI uri = safeUri(candidate);
        if (uri == null || uri.getHost() == null || uri.getHost().isBlank()) {
            return false;
        }
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
