package com.delta.redirects.resolve.model;

public record UrlClassification(UrlCategory category, String code, boolean decodeFailed) {
    public static UrlClassification undecodable() {
        return new UrlClassification(null, null, true);
    }

    public boolean isResolvable() {
        return category != null && code != null && !code.isEmpty();
    }
}
