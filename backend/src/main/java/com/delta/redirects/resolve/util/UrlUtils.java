package com.delta.redirects.resolve.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    public static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static boolean sameIgnoringTrailingSlash(String first, String second) {
        if (first == null || second == null) {
            return first == null && second == null;
        }
        return stripTrailingSlash(first).equals(stripTrailingSlash(second));
    }

    public static String origin(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        StringBuilder out = new StringBuilder()
            .append(uri.getScheme().toLowerCase(Locale.ROOT))
            .append("://")
            .append(uri.getHost());
        if (uri.getPort() > 0) {
            out.append(':').append(uri.getPort());
        }
        return out.toString();
    }

    public static String targetUrl(String baseUrl, String categorySegment, String code) {
        return stripTrailingSlash(baseUrl) + "/" + categorySegment + "/" + code;
    }

    public static String toPath(String url) {
        if (url == null) {
            return null;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return url;
        }
        int schemeEnd = url.indexOf("://") + 3;
        int pathStart = url.indexOf('/', schemeEnd);
        return pathStart < 0 ? "/" : url.substring(pathStart);
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
}
